package com.example.modelbridge.api;

import tools.jackson.databind.node.ObjectNode;

/**
 * Base class of the failures the bridge reports to callers as an error envelope.
 */
public abstract class BridgeException extends RuntimeException {

    protected BridgeException(String message) {
        super(message);
    }

    public abstract ErrorCode errorCode();

    /**
     * Adds the failure's details to its envelope. The envelope already carries {@code success},
     * {@code error} and {@code message}.
     */
    public void describe(ObjectNode body) {
    }
}
