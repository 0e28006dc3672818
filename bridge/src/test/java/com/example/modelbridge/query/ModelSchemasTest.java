package com.example.modelbridge.query;

import com.example.modelbridge.BridgeFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ModelSchemas")
class ModelSchemasTest {

    private final ModelSchemas schemas = BridgeFixture.withEmptyModel().schemas;

    private static List<String> values(JsonNode list) {
        List<String> values = new ArrayList<>();
        list.forEach(element -> values.add(element.asString()));
        return values;
    }

    @Test
    @DisplayName("every kind listed can be fetched")
    void kinds() {
        List<String> kinds = new ArrayList<>();
        schemas.kinds().forEach(entry -> kinds.add(entry.get("kind").asString()));

        assertThat(kinds).contains("data_object", "lookup_value", "role", "user_story", "form", "report",
                "general_flow", "page_init_flow", "workflow");
        kinds.forEach(kind -> assertTrue(schemas.schema(kind).isPresent(), kind));
    }

    @Test
    @DisplayName("data types and visualization types are enumerated")
    void enumerations() {
        ObjectNode dataObject = schemas.schema("data_object").orElseThrow();
        ObjectNode report = schemas.schema("report").orElseThrow();

        JsonNode propFields = dataObject.get("properties").get("prop").get("items").get("properties");
        assertThat(values(propFields.get("sqlServerDBDataType").get("enum"))).contains("nvarchar", "int", "datetime");
        assertThat(values(report.get("properties").get("visualizationType").get("enum"))).contains("Grid", "PieChart");
        assertThat(values(propFields.get("isFK").get("enum"))).containsExactly("true", "false");
    }

    @Test
    @DisplayName("the role schema points at the Role lookup")
    void role() {
        ObjectNode role = schemas.schema(" Role ").orElseThrow();

        assertEquals("Role", role.get("objectName").asString());
        assertTrue(role.get("isLookupObject").asBoolean());
        assertTrue(role.get("properties").get("name").get("required").asBoolean());
        assertFalse(role.get("properties").get("displayName").get("required").asBoolean());
    }

    @Test
    @DisplayName("unknown kinds are empty")
    void unknown() {
        assertTrue(schemas.schema("spaceship").isEmpty());
        assertTrue(schemas.schema(null).isEmpty());
    }
}
