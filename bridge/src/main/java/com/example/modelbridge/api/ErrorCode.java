package com.example.modelbridge.api;

/**
 * Error codes carried in the {@code error} field of failure envelopes, with their HTTP status.
 */
public enum ErrorCode {

    NOT_FOUND("not_found", 404),
    VALIDATION_FAILED("validation_failed", 400),
    BOUNDS_ERROR("bounds_error", 400),
    AMBIGUOUS("ambiguous", 400),
    UNKNOWN_COMMAND("unknown_command", 404),
    BAD_REQUEST("bad_request", 400),
    INTERNAL("internal", 500);

    private final String code;
    private final int status;

    ErrorCode(String code, int status) {
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public int status() {
        return status;
    }
}
