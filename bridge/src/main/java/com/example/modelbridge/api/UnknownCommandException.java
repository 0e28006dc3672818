package com.example.modelbridge.api;

import lombok.Getter;

@Getter
public class UnknownCommandException extends BridgeException {

    private final String command;

    public UnknownCommandException(String command) {
        super("Unknown command: " + command);
        this.command = command;
    }

    @Override
    public ErrorCode errorCode() {
        return ErrorCode.UNKNOWN_COMMAND;
    }
}
