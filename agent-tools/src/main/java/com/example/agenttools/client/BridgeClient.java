package com.example.agenttools.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Calls the model bridge on behalf of the tools.
 * <p>
 * Data channel reads are retried (up to {@link BridgeClientSettings#readRetries()} extra times,
 * re-locating the bridge in between). Commands are sent once. When the bridge cannot be reached the
 * caller receives a degraded reply, {@code {success:false, error:"channel_unavailable", note}},
 * instead of an exception.
 * </p>
 */
@Slf4j
public class BridgeClient {

    public static final String CHANNEL_UNAVAILABLE = "channel_unavailable";

    private final BridgeClientSettings settings;
    private final BridgeTransport transport;
    private final BridgeEndpointLocator locator;
    private final JsonMapper jsonMapper;

    public BridgeClient(BridgeClientSettings settings, JsonMapper jsonMapper) {
        this(settings, new BridgeTransport(settings, jsonMapper), jsonMapper);
    }

    BridgeClient(BridgeClientSettings settings, BridgeTransport transport, JsonMapper jsonMapper) {
        this.settings = settings;
        this.transport = transport;
        this.locator = new BridgeEndpointLocator(settings, transport);
        this.jsonMapper = jsonMapper;
    }

    /**
     * GET on the data channel. Blank query values are left out.
     */
    public BridgeReply query(String path, Map<String, String> params) {
        int attempts = settings.readRetries() + 1;
        BridgeUnavailableException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                BridgeEndpoints endpoints = locator.locate();
                return transport.get(withQuery(endpoints.dataUrl(path), params));
            } catch (BridgeUnavailableException e) {
                last = e;
                locator.invalidate();
                if (attempt < attempts) {
                    log.debug("Retrying data channel read path={} attempt={}: {}", path, attempt + 1, e.getMessage());
                }
            }
        }
        log.warn("Data channel unavailable for {}: {}", path, last.getMessage());
        return degraded("Model data not reachable: " + last.getMessage());
    }

    public BridgeReply query(String path) {
        return query(path, Map.of());
    }

    /**
     * Sends one command to the command channel. Never retried: a command that timed out may still
     * have been applied, so callers re-read the model before sending it again.
     */
    public BridgeReply executeCommand(String command, JsonNode args) {
        ObjectNode body = jsonMapper.createObjectNode();
        body.put("command", command);
        body.set("args", args != null ? args : jsonMapper.createObjectNode());
        BridgeEndpoints endpoints;
        try {
            endpoints = locator.locate();
        } catch (BridgeUnavailableException e) {
            log.warn("Command channel unavailable for {}: {}", command, e.getMessage());
            return degraded("Command '" + command + "' was not sent: " + e.getMessage());
        }
        try {
            BridgeReply reply = transport.post(endpoints.commandUrl("/api/execute-command"), body);
            log.info("Executed command={} status={}", command, reply.status());
            return reply;
        } catch (BridgeUnavailableException e) {
            locator.invalidate();
            log.warn("Command {} failed: {}", command, e.getMessage());
            if (isConnectionRefused(e)) {
                return degraded("Command '" + command + "' was not applied: the command channel is not running");
            }
            return degraded("Command '" + command + "' may or may not have been applied (" + e.getMessage()
                    + "); re-read the model before retrying");
        }
    }

    /**
     * GET on the command channel, e.g. {@code /api/commands}. Not retried.
     */
    public BridgeReply commandQuery(String path) {
        try {
            BridgeEndpoints endpoints = locator.locate();
            return transport.get(endpoints.commandUrl(path));
        } catch (BridgeUnavailableException e) {
            locator.invalidate();
            log.warn("Command channel unavailable for {}: {}", path, e.getMessage());
            return degraded("Command channel not reachable: " + e.getMessage());
        }
    }

    /** Whether a bridge currently answers on the configured ports. */
    public boolean isAvailable() {
        try {
            locator.locate();
            return true;
        } catch (BridgeUnavailableException e) {
            return false;
        }
    }

    public BridgeReply degraded(String note) {
        ObjectNode body = jsonMapper.createObjectNode();
        body.put("success", false);
        body.put("error", CHANNEL_UNAVAILABLE);
        body.put("note", note);
        return new BridgeReply(503, body);
    }

    BridgeEndpointLocator locator() {
        return locator;
    }

    /** {@code url} must already be encoded; query values are encoded here. */
    private static String withQuery(String url, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(url);
        params.forEach((name, value) -> {
            if (value != null && !value.isBlank()) {
                builder.queryParam(name, UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8));
            }
        });
        return builder.build(true).toUriString();
    }

    private static boolean isConnectionRefused(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConnectException) {
                return true;
            }
        }
        return false;
    }
}
