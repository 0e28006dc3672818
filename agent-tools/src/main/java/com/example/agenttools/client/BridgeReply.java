package com.example.agenttools.client;

import tools.jackson.databind.JsonNode;

/**
 * HTTP status and parsed JSON body of one bridge call.
 */
public record BridgeReply(int status, JsonNode body) {

    public boolean isOk() {
        return status >= 200 && status < 300;
    }
}
