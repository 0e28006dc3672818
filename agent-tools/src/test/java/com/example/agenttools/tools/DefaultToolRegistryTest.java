package com.example.agenttools.tools;

import com.example.agenttools.RunningBridge;
import com.example.agenttools.client.BridgeClient;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DefaultToolRegistry")
class DefaultToolRegistryTest {

    private final JsonMapper jsonMapper = RunningBridge.jsonMapper();
    private final DefaultToolRegistry registry = registry(
            new BridgeClient(RunningBridge.unreachableSettings(), jsonMapper), jsonMapper);

    static DefaultToolRegistry registry(BridgeClient client, JsonMapper jsonMapper) {
        Map<String, Object> tools = new LinkedHashMap<>();
        tools.put("data-objects", new DataObjectTools(client, jsonMapper));
        tools.put("forms", new FormTools(client, jsonMapper));
        tools.put("reports", new ReportTools(client, jsonMapper));
        tools.put("flows", new FlowTools(client, jsonMapper));
        tools.put("lookups", new LookupTools(client, jsonMapper));
        tools.put("model", new ModelTools(client, jsonMapper));
        return new DefaultToolRegistry(tools, jsonMapper);
    }

    @Test
    @DisplayName("returns tools for known ids in order")
    void returnsToolsForKnownIds() {
        Object[] tools = registry.getTools(List.of("forms", "data-objects"));
        assertNotNull(tools);
        assertEquals(2, tools.length);
        assertThat(tools[0]).isInstanceOf(FormTools.class);
        assertThat(tools[1]).isInstanceOf(DataObjectTools.class);
    }

    @Test
    @DisplayName("returns empty array for empty or null list")
    void returnsEmptyForEmptyList() {
        assertEquals(0, registry.getTools(List.of()).length);
        assertEquals(0, registry.getTools(null).length);
    }

    @Test
    @DisplayName("skips unknown ids")
    void skipsUnknownIds() {
        Object[] tools = registry.getTools(List.of("unknown", "model"));
        assertEquals(1, tools.length);
    }

    @Test
    @DisplayName("returns available tool ids sorted")
    void returnsAvailableToolIds() {
        assertEquals(List.of("data-objects", "flows", "forms", "lookups", "model", "reports"),
                registry.getAvailableToolIds());
    }

    @Test
    @DisplayName("describes tools with snake_case names and required parameters")
    void specifications() {
        List<ToolSpecification> specifications = registry.getToolSpecifications(List.of("forms"));

        ToolSpecification addParam = specifications.stream()
                .filter(specification -> specification.name().equals("add_form_param"))
                .findFirst()
                .orElseThrow();
        assertThat(specifications).extracting(ToolSpecification::name)
                .contains("list_forms", "get_form", "create_form", "move_form_output_var")
                .allMatch(name -> name.matches("[a-z_]+"));
        assertThat(addParam.parameters().properties()).containsKeys("formName", "ownerObjectName", "param");
        assertThat(addParam.parameters().required()).contains("formName", "param").doesNotContain("ownerObjectName");
    }

    @Test
    @DisplayName("every tool name is unique across groups")
    void toolNames() {
        List<String> names = registry.getToolNames();
        assertThat(names).doesNotHaveDuplicates()
                .contains("create_data_object", "create_report", "create_general_flow", "move_lookup_value",
                        "create_user_story", "update_user_story", "add_role", "update_role", "list_workflows",
                        "get_workflow_schema", "resolve_entity", "execute_model_command");
        int specified = registry.getToolSpecifications(registry.getAvailableToolIds()).size();
        assertEquals(names.size(), specified);
    }

    @Test
    @DisplayName("answers unknown tools with a failure object")
    void unknownTool() {
        JsonNode result = execute("drop_model", "{}");

        assertEquals("unknown_tool", result.get("error").asString());
        assertTrue(result.get("note").asString().contains("drop_model"));
    }

    @Test
    @DisplayName("degrades tool calls when no bridge is running")
    void degradedWithoutBridge() {
        JsonNode list = execute("list_data_objects", "{\"isLookup\":\"true\"}");
        JsonNode create = execute("create_form",
                "{\"ownerObjectName\":\"Customer\",\"formName\":\"CustomerEditForm\",\"titleText\":\"Edit\"}");

        assertEquals(BridgeClient.CHANNEL_UNAVAILABLE, list.get("error").asString());
        assertEquals(BridgeClient.CHANNEL_UNAVAILABLE, create.get("error").asString());
        assertThat(list.get("success").asBoolean()).isFalse();
    }

    private JsonNode execute(String tool, String arguments) {
        String result = registry.execute(ToolExecutionRequest.builder().id("1").name(tool).arguments(arguments).build());
        return jsonMapper.readTree(result);
    }
}
