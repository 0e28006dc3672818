package com.example.agenttools.tools;

import com.example.agenttools.client.BridgeClient;
import com.example.agenttools.client.BridgeReply;
import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Model-wide tools: bridge status, the command catalogue, name resolution and raw command execution.
 */
public class ModelTools extends BridgeTools {

    public ModelTools(BridgeClient client, JsonMapper jsonMapper) {
        super(client, jsonMapper);
    }

    @Tool(name = "get_model_status", value = "Report whether a model is open, its document name and the bridge ports")
    public String getModelStatus() {
        return item("/api/health", "status");
    }

    @Tool(name = "list_model_commands", value = "List every command the bridge accepts with its argument names "
            + "and whether it changes the model")
    public String listModelCommands() {
        BridgeReply reply = client.commandQuery("/api/commands");
        if (!reply.isOk()) {
            return write(reply.body());
        }
        ObjectNode result = jsonMapper.createObjectNode();
        result.put("success", true);
        result.set("commands", reply.body());
        result.put("count", reply.body().size());
        return write(result);
    }

    @Tool(name = "resolve_entity", value = "Find which data object owns a named entity. Reports ambiguous=true with "
            + "all candidate owners when the name exists under several objects.")
    public String resolveEntity(@P("data_object, form, report, general_flow or page_init_flow") String kind,
                                @P("Name of the entity") String name,
                                @P(value = "Preferred owning data object", required = false) String ownerObjectName) {
        BridgeReply reply = client.query("/api/resolve",
                filters("kind", kind, "name", name, "owner_object_name", ownerObjectName));
        if (!reply.isOk()) {
            return write(reply.body());
        }
        ObjectNode result = jsonMapper.createObjectNode();
        result.put("success", true);
        result.set("resolution", reply.body());
        if (reply.body().path("ambiguous").asBoolean(false)) {
            result.put("note", "Several data objects own '" + name + "'; pass owner_object_name to mutations");
        }
        return write(result);
    }

    @Tool(name = "execute_model_command", value = "Run any bridge command by name. Use list_model_commands for the "
            + "available commands and their argument names.")
    public String executeModelCommand(@P("Command name, e.g. \"add_report_column\"") String command,
                                      @P(value = "Command arguments", required = false) Map<String, Object> args) {
        return command(command, toNode(args));
    }
}
