package com.example.agenttools.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Where and how the tool process reaches the model bridge.
 *
 * @param host          bridge host
 * @param dataPort      first port probed for the data channel
 * @param portScanRange number of consecutive ports probed, starting at {@code dataPort}
 * @param readRetries   extra attempts for data channel reads; commands are never retried
 */
public record BridgeClientSettings(
        String host,
        int dataPort,
        int portScanRange,
        Duration connectTimeout,
        Duration readTimeout,
        int readRetries
) {
    public static final int DEFAULT_DATA_PORT = 3001;

    public BridgeClientSettings {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(readTimeout, "readTimeout");
        if (portScanRange < 1) {
            throw new IllegalArgumentException("portScanRange must be at least 1");
        }
        if (readRetries < 0) {
            throw new IllegalArgumentException("readRetries must not be negative");
        }
    }

    public static BridgeClientSettings defaults() {
        return new BridgeClientSettings("127.0.0.1", DEFAULT_DATA_PORT, 10,
                Duration.ofSeconds(2), Duration.ofSeconds(5), 1);
    }

    public int lastPort() {
        return dataPort + portScanRange - 1;
    }
}
