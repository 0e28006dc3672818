package com.example.modelbridge.http;

import com.example.modelbridge.api.BridgeExceptionHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.tomcat.servlet.TomcatServletWebServerFactory;
import org.springframework.boot.web.server.WebServer;
import org.springframework.boot.web.server.WebServerException;
import org.springframework.boot.web.servlet.ServletRegistrationBean;
import org.springframework.web.context.support.AnnotationConfigWebApplicationContext;
import org.springframework.web.servlet.DispatcherServlet;
import tools.jackson.databind.json.JsonMapper;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * One HTTP listener of the bridge: an embedded Tomcat running a Spring MVC dispatcher with the
 * channel's controller, {@link BridgeControllerAdvice} and {@link ChannelMvcConfiguration}.
 * <p>
 * Binds its preferred port, moving to the next port after a short delay while the port is in use,
 * up to {@link BridgeSettings#maxPortAttempts()} attempts and never past port 65535.
 * </p>
 */
@Slf4j
public class BridgeChannel {

    static final int MAX_PORT = 65535;

    private final ChannelType type;
    private final BridgeSettings settings;
    private final Object controller;
    private final JsonMapper jsonMapper;
    private final BridgeExceptionHandler exceptionHandler;

    private WebServer webServer;
    private AnnotationConfigWebApplicationContext webContext;
    private volatile int port = -1;

    public BridgeChannel(ChannelType type, BridgeSettings settings, Object controller, JsonMapper jsonMapper,
                         BridgeExceptionHandler exceptionHandler) {
        this.type = type;
        this.settings = settings;
        this.controller = controller;
        this.jsonMapper = jsonMapper;
        this.exceptionHandler = exceptionHandler;
    }

    /**
     * Binds and starts the listener.
     *
     * @return the bound port
     * @throws BridgeStartupException when no port in the retry range can be bound
     */
    public synchronized int start() {
        if (webServer != null) {
            return port;
        }
        int preferred = settings.preferredPort(type);
        if (preferred < 0 || preferred > MAX_PORT) {
            throw new BridgeStartupException(type, "Preferred " + type.label() + " port " + preferred
                    + " is outside 0-" + MAX_PORT, null);
        }
        InetAddress address = address();
        int attempts = preferred == 0 ? 1 : Math.min(settings.maxPortAttempts(), MAX_PORT - preferred + 1);
        WebServerException lastFailure = null;
        for (int i = 0; i < attempts; i++) {
            int tryPort = preferred == 0 ? 0 : preferred + i;
            AnnotationConfigWebApplicationContext context = newWebContext();
            WebServer candidate = null;
            try {
                candidate = newWebServer(address, tryPort, context);
                candidate.start();
                webServer = candidate;
                webContext = context;
                break;
            } catch (WebServerException e) {
                lastFailure = e;
                release(candidate, context);
                if (i < attempts - 1) {
                    log.warn("{} channel port {} in use, trying {}", type.label(), tryPort, tryPort + 1);
                    pause();
                }
            }
        }
        if (webServer == null) {
            throw new BridgeStartupException(type, preferred, preferred + attempts - 1, lastFailure);
        }
        port = webServer.getPort();
        if (preferred != 0 && port != preferred) {
            log.info("{} channel listening on {}:{} (preferred port {} was in use)", type.label(), settings.host(), port, preferred);
        } else {
            log.info("{} channel listening on {}:{}", type.label(), settings.host(), port);
        }
        return port;
    }

    public synchronized void stop() {
        if (webServer != null) {
            release(webServer, webContext);
            webServer = null;
            webContext = null;
            log.info("{} channel stopped (port {})", type.label(), port);
            port = -1;
        }
    }

    public ChannelType type() {
        return type;
    }

    /** The bound port, or {@code -1} when not running. */
    public int port() {
        return port;
    }

    public boolean isRunning() {
        return port > 0;
    }

    private AnnotationConfigWebApplicationContext newWebContext() {
        AnnotationConfigWebApplicationContext context = new AnnotationConfigWebApplicationContext();
        context.setDisplayName(type.label() + " channel");
        context.register(ChannelMvcConfiguration.class);
        context.addBeanFactoryPostProcessor(beanFactory -> {
            beanFactory.registerSingleton("jsonMapper", jsonMapper);
            beanFactory.registerSingleton("bridgeControllerAdvice", new BridgeControllerAdvice(exceptionHandler));
            beanFactory.registerSingleton(type.label() + "ChannelController", controller);
        });
        return context;
    }

    private WebServer newWebServer(InetAddress address, int tryPort, AnnotationConfigWebApplicationContext context) {
        TomcatServletWebServerFactory factory = new TomcatServletWebServerFactory();
        factory.setAddress(address);
        factory.setPort(tryPort);
        ServletRegistrationBean<DispatcherServlet> dispatcher =
                new ServletRegistrationBean<>(new DispatcherServlet(context), "/");
        dispatcher.setName(type.label() + "-dispatcher");
        dispatcher.setLoadOnStartup(1);
        return factory.getWebServer(dispatcher);
    }

    private void release(WebServer server, AnnotationConfigWebApplicationContext context) {
        if (server != null) {
            try {
                server.stop();
                server.destroy();
            } catch (WebServerException e) {
                log.warn("{} channel did not shut down cleanly: {}", type.label(), e.getMessage());
            }
        }
        if (context.isActive()) {
            context.close();
        }
    }

    private InetAddress address() {
        try {
            return InetAddress.getByName(settings.host());
        } catch (UnknownHostException e) {
            throw new BridgeStartupException(type, "Unknown " + type.label() + " channel host " + settings.host(), e);
        }
    }

    private void pause() {
        try {
            Thread.sleep(settings.portRetryDelay().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeStartupException(type, "Interrupted while binding " + type.label() + " channel", e);
        }
    }
}
