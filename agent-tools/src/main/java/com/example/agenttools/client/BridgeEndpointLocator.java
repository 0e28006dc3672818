package com.example.agenttools.client;

import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.JsonNode;

/**
 * Finds the bridge by probing {@code /api/health} from the configured data port upward. The first
 * port answering as the data channel wins; the command port is taken from its health payload.
 * The result is cached until {@link #invalidate()}.
 */
@Slf4j
public class BridgeEndpointLocator {

    private final BridgeClientSettings settings;
    private final BridgeTransport transport;

    private volatile BridgeEndpoints cached;

    public BridgeEndpointLocator(BridgeClientSettings settings, BridgeTransport transport) {
        this.settings = settings;
        this.transport = transport;
    }

    /**
     * @throws BridgeUnavailableException when no port in the scan range answers as a data channel
     */
    public BridgeEndpoints locate() {
        BridgeEndpoints endpoints = cached;
        if (endpoints != null) {
            return endpoints;
        }
        synchronized (this) {
            if (cached == null) {
                cached = scan();
            }
            return cached;
        }
    }

    public void invalidate() {
        cached = null;
    }

    private BridgeEndpoints scan() {
        for (int port = settings.dataPort(); port <= settings.lastPort(); port++) {
            String url = "http://" + settings.host() + ":" + port + "/api/health";
            try {
                BridgeReply reply = transport.get(url);
                JsonNode health = reply.body();
                if (reply.isOk() && "data".equals(health.path("channel").asString(""))) {
                    int commandPort = health.path("commandPort").asInt(-1);
                    if (commandPort <= 0) {
                        log.warn("Data channel on port {} reports no command channel", port);
                        continue;
                    }
                    log.info("Found model bridge dataPort={} commandPort={}", port, commandPort);
                    return new BridgeEndpoints(settings.host(), port, commandPort);
                }
                log.debug("Port {} answered but is not a data channel", port);
            } catch (BridgeUnavailableException e) {
                log.debug("No bridge on port {}: {}", port, e.getMessage());
            }
        }
        throw new BridgeUnavailableException("Model bridge not reachable on " + settings.host() + " ports "
                + settings.dataPort() + "-" + settings.lastPort() + "; is the host application running?");
    }
}
