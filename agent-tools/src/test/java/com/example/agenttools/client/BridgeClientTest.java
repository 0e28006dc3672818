package com.example.agenttools.client;

import com.example.agenttools.RunningBridge;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BridgeClient against a running bridge")
class BridgeClientTest {

    private static RunningBridge bridge;
    private static BridgeClient client;

    @BeforeAll
    static void startBridge() {
        bridge = RunningBridge.start();
        client = new BridgeClient(bridge.clientSettings(), RunningBridge.jsonMapper());
    }

    @AfterAll
    static void stopBridge() {
        bridge.close();
    }

    @Test
    @DisplayName("finds the data channel by scanning and reads the command port from its health payload")
    void discoversBothChannels() {
        BridgeEndpoints endpoints = client.locator().locate();

        assertThat(endpoints.dataPort()).isEqualTo(bridge.dataPort());
        assertThat(endpoints.commandPort()).isEqualTo(bridge.commandPort());
        assertThat(client.isAvailable()).isTrue();
    }

    @Test
    @DisplayName("queries the data channel with encoded filters")
    void queriesWithFilters() {
        BridgeReply lookups = client.query("/api/data-objects", Map.of("is_lookup", "true"));
        BridgeReply bySpacedName = client.query("/api/data-objects", Map.of("search_name", "Cust omer"));

        assertThat(lookups.isOk()).isTrue();
        assertThat(lookups.body()).hasSize(1);
        assertThat(lookups.body().get(0).get("name").asString()).isEqualTo("Role");
        assertThat(bySpacedName.isOk()).isTrue();
        assertThat(bySpacedName.body().get(0).get("name").asString()).isEqualTo("Customer");
    }

    @Test
    @DisplayName("passes 404 envelopes through instead of degrading")
    void notFoundIsNotDegraded() {
        BridgeReply reply = client.query("/api/data-objects/Missing");

        assertThat(reply.status()).isEqualTo(404);
        assertThat(reply.body().get("error").asString()).isEqualTo("not_found");
    }

    @Test
    @DisplayName("a command applied on the command channel is visible on the data channel")
    void commandThenRead() {
        ObjectNode args = RunningBridge.jsonMapper().createObjectNode()
                .put("name", "Invoice")
                .put("parentObjectName", "Customer");

        BridgeReply created = client.executeCommand("create_data_object", args);
        BridgeReply read = client.query("/api/data-objects/Invoice");

        assertThat(created.isOk()).isTrue();
        assertThat(created.body().get("success").asBoolean()).isTrue();
        assertThat(read.isOk()).isTrue();
        assertThat(read.body().get("parentObjectName").asString()).isEqualTo("Customer");
    }

    @Test
    @DisplayName("returns the bridge envelope for rejected commands")
    void rejectedCommand() {
        BridgeReply reply = client.executeCommand("drop_everything", null);

        assertThat(reply.status()).isEqualTo(404);
        assertThat(reply.body().get("success").asBoolean()).isFalse();
        assertThat(reply.body().get("error").asString()).isEqualTo("unknown_command");
    }

    @Test
    @DisplayName("reads the command catalogue from the command channel")
    void readsCatalogue() {
        BridgeReply reply = client.commandQuery("/api/commands");

        assertThat(reply.isOk()).isTrue();
        assertThat(reply.body().isArray()).isTrue();
        List<String> names = new ArrayList<>();
        reply.body().forEach(command -> names.add(command.get("name").asString()));
        assertThat(names).contains("create_form", "move_lookup_value");
    }

    @Test
    @DisplayName("health reports the sample model as loaded")
    void health() {
        JsonNode health = client.query("/api/health").body();

        assertThat(health.get("channel").asString()).isEqualTo("data");
        assertThat(health.get("modelLoaded").asBoolean()).isTrue();
        assertThat(health.get("documentName").asString()).isEqualTo("sample-model.json");
    }
}
