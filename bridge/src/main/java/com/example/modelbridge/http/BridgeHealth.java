package com.example.modelbridge.http;

import com.example.modelbridge.document.ModelDocumentStore;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Builds the health payload both channels serve, including the bound ports so clients can find
 * the command channel from the data channel and vice versa.
 */
public class BridgeHealth {

    private final JsonMapper jsonMapper;
    private final ModelDocumentStore store;
    private final Map<ChannelType, BridgeChannel> channels = new EnumMap<>(ChannelType.class);

    public BridgeHealth(JsonMapper jsonMapper, ModelDocumentStore store) {
        this.jsonMapper = jsonMapper;
        this.store = store;
    }

    void register(BridgeChannel channel) {
        channels.put(channel.type(), channel);
    }

    public ObjectNode report(ChannelType channel) {
        ObjectNode health = jsonMapper.createObjectNode();
        health.put("status", "ok");
        health.put("channel", channel.label());
        health.put("port", portOf(channel));
        health.put("dataPort", portOf(ChannelType.DATA));
        health.put("commandPort", portOf(ChannelType.COMMAND));
        health.put("modelLoaded", !ModelDocumentStore.UNTITLED.equals(store.documentName()));
        health.put("documentName", store.documentName());
        health.put("dirty", store.isDirty());
        health.put("timestamp", Instant.now().toString());
        return health;
    }

    private int portOf(ChannelType type) {
        BridgeChannel channel = channels.get(type);
        return channel != null ? channel.port() : -1;
    }
}
