package com.example.modelbridge.http;

/**
 * The two listeners of the bridge: read-only queries and model-mutating commands.
 */
public enum ChannelType {

    DATA("data"),
    COMMAND("command");

    private final String label;

    ChannelType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
