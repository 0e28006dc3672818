package com.example.modelbridge.api;

/**
 * Thrown for requests that cannot be interpreted at all, such as a body that is not JSON.
 */
public class BadRequestException extends BridgeException {

    public BadRequestException(String message) {
        super(message);
    }

    @Override
    public ErrorCode errorCode() {
        return ErrorCode.BAD_REQUEST;
    }
}
