package com.example.modelbridge.http;

import lombok.Getter;

/**
 * Thrown when a channel cannot bind any port in its retry range. Fatal for the host.
 */
@Getter
public class BridgeStartupException extends RuntimeException {

    private final ChannelType channel;
    private final int firstPort;
    private final int lastPort;

    public BridgeStartupException(ChannelType channel, int firstPort, int lastPort, Throwable cause) {
        super("Could not bind " + channel.label() + " channel to any port in " + firstPort + "-" + lastPort, cause);
        this.channel = channel;
        this.firstPort = firstPort;
        this.lastPort = lastPort;
    }

    public BridgeStartupException(ChannelType channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
        this.firstPort = -1;
        this.lastPort = -1;
    }
}
