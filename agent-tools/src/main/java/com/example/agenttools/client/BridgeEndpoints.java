package com.example.agenttools.client;

/**
 * Ports of a running bridge, as reported by its data channel health payload.
 */
public record BridgeEndpoints(String host, int dataPort, int commandPort) {

    public String dataUrl(String path) {
        return "http://" + host + ":" + dataPort + path;
    }

    public String commandUrl(String path) {
        return "http://" + host + ":" + commandPort + path;
    }
}
