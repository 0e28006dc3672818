package com.example.modelbridge.http;

import org.springframework.http.HttpMethod;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.URI;

/**
 * HTTP helpers shared by the listener tests.
 */
final class TestHttp {

    private TestHttp() {
    }

    /** A RestTemplate that hands back 4xx and 5xx responses instead of throwing. */
    static RestTemplate restTemplate() {
        RestTemplate rest = new RestTemplate(new JdkClientHttpRequestFactory());
        rest.setErrorHandler(new ResponseErrorHandler() {
            @Override
            public boolean hasError(ClientHttpResponse response) {
                return false;
            }

            @Override
            public void handleError(URI url, HttpMethod method, ClientHttpResponse response) throws IOException {
            }
        });
        return rest;
    }

    /**
     * Occupies a loopback port whose successor is free at the time of the call.
     */
    static ServerSocket occupyPortWithFreeSuccessor() throws IOException {
        InetAddress loopback = InetAddress.getByName("127.0.0.1");
        for (int attempt = 0; attempt < 50; attempt++) {
            ServerSocket blocker = new ServerSocket(0, 50, loopback);
            int next = blocker.getLocalPort() + 1;
            if (next <= 65535 && isFree(next, loopback)) {
                return blocker;
            }
            blocker.close();
        }
        throw new IllegalStateException("No pair of consecutive free ports found");
    }

    /**
     * First port of a run of {@code count} consecutive loopback ports that were all free when checked.
     */
    static int freePortRun(int count) throws IOException {
        InetAddress loopback = InetAddress.getByName("127.0.0.1");
        for (int attempt = 0; attempt < 50; attempt++) {
            int first;
            try (ServerSocket socket = new ServerSocket(0, 1, loopback)) {
                first = socket.getLocalPort();
            }
            boolean free = first + count - 1 <= 65535;
            for (int port = first; free && port < first + count; port++) {
                free = isFree(port, loopback);
            }
            if (free) {
                return first;
            }
        }
        throw new IllegalStateException("No run of " + count + " free ports found");
    }

    static boolean isFree(int port, InetAddress address) {
        try (ServerSocket socket = new ServerSocket(port, 1, address)) {
            return socket.getLocalPort() == port;
        } catch (IOException e) {
            return false;
        }
    }
}
