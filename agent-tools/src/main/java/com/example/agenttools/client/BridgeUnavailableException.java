package com.example.agenttools.client;

/**
 * The bridge could not be reached or answered with something that is not JSON. Never escapes
 * {@link BridgeClient}; it is turned into a degraded reply there.
 */
public class BridgeUnavailableException extends RuntimeException {

    public BridgeUnavailableException(String message) {
        super(message);
    }

    public BridgeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
