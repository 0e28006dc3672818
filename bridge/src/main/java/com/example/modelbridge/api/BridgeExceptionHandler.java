package com.example.modelbridge.api;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;

/**
 * Builds the envelopes both channels answer with: {@code {success:true, ...}} or
 * {@code {success:false, error, message, ...}}.
 * <p>
 * Domain failures are logged at warn and carry their own details; anything else is an internal
 * error, logged with its stack trace and reported with a generic message.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class BridgeExceptionHandler {

    private final JsonMapper jsonMapper;

    /** A success envelope: {@code success:true} followed by the payload fields. */
    public ObjectNode success(ObjectNode payload) {
        ObjectNode body = jsonMapper.createObjectNode();
        body.put("success", true);
        if (payload != null) {
            body.setAll(payload);
        }
        return body;
    }

    public ObjectNode failure(ErrorCode code, String message) {
        ObjectNode body = jsonMapper.createObjectNode();
        body.put("success", false);
        body.put("error", code.code());
        body.put("message", message);
        return body;
    }

    public ErrorReply handle(BridgeException ex) {
        log.warn("Request rejected ({}): {}", ex.errorCode().code(), ex.getMessage());
        ObjectNode body = failure(ex.errorCode(), ex.getMessage());
        ex.describe(body);
        return new ErrorReply(ex.errorCode(), body);
    }

    public ErrorReply invalidArgument(IllegalArgumentException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return new ErrorReply(ErrorCode.BAD_REQUEST, failure(ErrorCode.BAD_REQUEST,
                ex.getMessage() != null ? ex.getMessage() : "Invalid request"));
    }

    public ErrorReply internal(Exception ex) {
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return new ErrorReply(ErrorCode.INTERNAL,
                failure(ErrorCode.INTERNAL, "An internal error occurred while handling the request"));
    }

    /**
     * Error code plus envelope body.
     */
    public record ErrorReply(ErrorCode code, ObjectNode body) {

        public int status() {
            return code.status();
        }
    }
}
