package com.example.modelbridge.command;

import com.example.modelbridge.api.ErrorCode;
import tools.jackson.databind.node.ObjectNode;

/**
 * Envelope produced by the dispatcher. {@code error} is {@code null} on success.
 */
public record CommandResult(ErrorCode error, ObjectNode body) {

    public boolean success() {
        return error == null;
    }

    public int status() {
        return error == null ? 200 : error.status();
    }
}
