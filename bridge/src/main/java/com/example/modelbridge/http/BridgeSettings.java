package com.example.modelbridge.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Listener settings of the bridge. A preferred port of {@code 0} binds an ephemeral port.
 */
public record BridgeSettings(
        String host,
        int dataPort,
        int commandPort,
        int maxPortAttempts,
        Duration portRetryDelay
) {
    public static final int DEFAULT_DATA_PORT = 3001;
    public static final int DEFAULT_COMMAND_PORT = 3002;

    public BridgeSettings {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(portRetryDelay, "portRetryDelay");
        if (maxPortAttempts < 1) {
            throw new IllegalArgumentException("maxPortAttempts must be at least 1");
        }
    }

    public static BridgeSettings defaults() {
        return new BridgeSettings("127.0.0.1", DEFAULT_DATA_PORT, DEFAULT_COMMAND_PORT, 10, Duration.ofMillis(100));
    }

    public int preferredPort(ChannelType channel) {
        return channel == ChannelType.DATA ? dataPort : commandPort;
    }
}
