package com.example.agenttools.tools;

import com.example.agenttools.client.BridgeClient;
import com.example.agenttools.client.BridgeReply;
import org.springframework.web.util.UriUtils;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared plumbing of the model tools: every tool answers with a JSON object carrying
 * {@code success}, optionally {@code error}, and optionally {@code note}.
 */
abstract class BridgeTools {

    protected final BridgeClient client;
    protected final JsonMapper jsonMapper;

    protected BridgeTools(BridgeClient client, JsonMapper jsonMapper) {
        this.client = client;
        this.jsonMapper = jsonMapper;
    }

    /** A data channel list, wrapped as {@code {success, <key>: [...], count, filters, note}}. */
    protected String list(String path, Map<String, String> filters, String key, String note) {
        BridgeReply reply = client.query(path, filters);
        if (!reply.isOk() || !reply.body().isArray()) {
            return failure(reply);
        }
        ObjectNode result = jsonMapper.createObjectNode();
        result.put("success", true);
        result.set(key, reply.body());
        result.put("count", reply.body().size());
        if (!filters.isEmpty()) {
            ObjectNode applied = result.putObject("filters");
            filters.forEach((name, value) -> {
                if (value == null || value.isBlank()) {
                    applied.putNull(name);
                } else {
                    applied.put(name, value);
                }
            });
        }
        result.put("note", note);
        return write(result);
    }

    /** A single data channel item, wrapped as {@code {success, <key>: {...}}}. */
    protected String item(String path, String key) {
        BridgeReply reply = client.query(path);
        if (!reply.isOk()) {
            return failure(reply);
        }
        ObjectNode result = jsonMapper.createObjectNode();
        result.put("success", true);
        result.set(key, reply.body());
        return write(result);
    }

    /** One schema of the data channel, wrapped as {@code {success, schema, note}}. */
    protected String schema(String kind) {
        BridgeReply reply = client.query("/api/schemas/" + segment(kind));
        if (!reply.isOk()) {
            return failure(reply);
        }
        ObjectNode result = jsonMapper.createObjectNode();
        result.put("success", true);
        result.set("schema", reply.body());
        result.put("note", "Attribute values are strings; read notes before building command arguments");
        return write(result);
    }

    /**
     * A list query expected to yield exactly one element; an empty list is reported as not found.
     */
    protected String single(String path, Map<String, String> filters, String key, String kindLabel, String name) {
        BridgeReply reply = client.query(path, filters);
        if (!reply.isOk() || !reply.body().isArray()) {
            return failure(reply);
        }
        JsonNode matches = reply.body();
        ObjectNode result = jsonMapper.createObjectNode();
        if (matches.isEmpty()) {
            result.put("success", false);
            result.put("error", "not_found");
            result.put("note", kindLabel + " '" + name + "' was not found");
        } else if (matches.size() > 1) {
            result.put("success", false);
            result.put("error", "ambiguous");
            result.put("note", kindLabel + " '" + name + "' exists under several data objects; pass owner_object_name");
            result.set("matches", matches);
        } else {
            result.put("success", true);
            result.set(key, matches.get(0));
        }
        return write(result);
    }

    /** Sends a command; the bridge envelope (or the degraded reply) is returned as is. */
    protected String command(String name, ObjectNode args) {
        return write(client.executeCommand(name, args).body());
    }

    /** {@code add_<kind>_<item>}: appends {@code item} to the named form, report or flow. */
    protected String addChild(String command, String workflowArgument, String workflowName, String ownerObjectName,
                              String itemArgument, Map<String, Object> item) {
        ObjectNode args = workflowArgs(workflowArgument, workflowName, ownerObjectName);
        args.set(itemArgument, toNode(item));
        return command(command, args);
    }

    protected String updateChild(String command, String workflowArgument, String workflowName, String ownerObjectName,
                                 String itemNameArgument, String itemName, Map<String, Object> updates) {
        ObjectNode args = workflowArgs(workflowArgument, workflowName, ownerObjectName);
        args.put(itemNameArgument, itemName);
        args.set("updates", toNode(updates));
        return command(command, args);
    }

    protected String moveChild(String command, String workflowArgument, String workflowName, String ownerObjectName,
                               String itemNameArgument, String itemName, Integer newPosition) {
        ObjectNode args = workflowArgs(workflowArgument, workflowName, ownerObjectName);
        args.put(itemNameArgument, itemName);
        args.put("new_position", newPosition);
        return command(command, args);
    }

    protected ObjectNode workflowArgs(String workflowArgument, String workflowName, String ownerObjectName) {
        ObjectNode args = args().put(workflowArgument, workflowName);
        return putIfPresent(args, "owner_object_name", ownerObjectName);
    }

    protected ObjectNode args() {
        return jsonMapper.createObjectNode();
    }

    protected ObjectNode toNode(Map<String, Object> value) {
        return value != null ? jsonMapper.valueToTree(value) : jsonMapper.createObjectNode();
    }

    protected static ObjectNode putIfPresent(ObjectNode node, String field, String value) {
        if (value != null && !value.isBlank()) {
            node.put(field, value);
        }
        return node;
    }

    protected static Map<String, String> filters(String... nameValuePairs) {
        Map<String, String> filters = new LinkedHashMap<>();
        for (int i = 0; i + 1 < nameValuePairs.length; i += 2) {
            filters.put(nameValuePairs[i], nameValuePairs[i + 1]);
        }
        return filters;
    }

    protected static String segment(String value) {
        return UriUtils.encodePathSegment(value != null ? value : "", StandardCharsets.UTF_8);
    }

    private String failure(BridgeReply reply) {
        JsonNode body = reply.body();
        if (body.isObject() && body.has("success")) {
            return write(body);
        }
        ObjectNode result = jsonMapper.createObjectNode();
        result.put("success", false);
        result.put("error", "unexpected_response");
        result.put("note", "Bridge answered with status " + reply.status());
        return write(result);
    }

    protected String write(JsonNode node) {
        return jsonMapper.writeValueAsString(node);
    }
}
