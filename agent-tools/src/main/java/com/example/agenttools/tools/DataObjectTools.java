package com.example.agenttools.tools;

import com.example.agenttools.client.BridgeClient;
import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Tools reading and editing data objects and their properties.
 */
public class DataObjectTools extends BridgeTools {

    public DataObjectTools(BridgeClient client, JsonMapper jsonMapper) {
        super(client, jsonMapper);
    }

    @Tool(name = "list_data_objects", value = "List data objects with optional filters. Returns name, isLookup, "
            + "parentObjectName, codeDescription and propCount of each object.")
    public String listDataObjects(
            @P(value = "Case-insensitive part of the object name; spaces are ignored", required = false) String searchName,
            @P(value = "\"true\" for lookup objects only, \"false\" for non-lookup objects only", required = false) String isLookup,
            @P(value = "Only objects with this parent object (case-insensitive)", required = false) String parentObjectName) {
        return list("/api/data-objects",
                filters("search_name", searchName, "is_lookup", isLookup, "parent_object_name", parentObjectName),
                "objects", "Data objects loaded from the model via the data channel");
    }

    @Tool(name = "get_data_object", value = "Get one data object with all its properties and lookup values")
    public String getDataObject(@P("Name of the data object") String name) {
        return item("/api/data-objects/" + segment(name), "object");
    }

    @Tool(name = "get_data_object_usage", value = "List where a data object is referenced: owned forms, reports and flows, "
            + "report columns, foreign keys and child objects. Without a name, returns reference counts for every object.")
    public String getDataObjectUsage(@P(value = "Name of the data object", required = false) String name) {
        if (name == null || name.isBlank()) {
            return list("/api/data-object-usage", Map.of(), "usage", "Reference counts per data object");
        }
        return item("/api/data-object-usage/" + segment(name), "usage");
    }

    @Tool(name = "create_data_object", value = "Create a data object. The name must be PascalCase and unique; "
            + "lookup objects must have parentObjectName \"Pac\".")
    public String createDataObject(
            @P("PascalCase name of the new object") String name,
            @P("Name of an existing parent object, e.g. \"Pac\"") String parentObjectName,
            @P(value = "\"true\" to create a lookup object; defaults to \"false\"", required = false) String isLookup,
            @P(value = "Description of the object", required = false) String codeDescription) {
        ObjectNode args = args();
        putIfPresent(args, "name", name);
        putIfPresent(args, "parentObjectName", parentObjectName);
        putIfPresent(args, "isLookup", isLookup);
        putIfPresent(args, "codeDescription", codeDescription);
        return command("create_data_object", args);
    }

    @Tool(name = "update_data_object", value = "Change the description of a data object")
    public String updateDataObject(@P("Name of the data object") String name,
                                   @P("New description") String codeDescription) {
        return command("update_data_object", args().put("name", name).put("codeDescription", codeDescription));
    }

    @Tool(name = "add_data_object_props", value = "Append properties to a data object. Each property is an object "
            + "with a PascalCase name and optional attributes such as sqlServerDBDataType, sqlServerDBDataTypeSize, "
            + "isFK and fkObjectName. Either all properties are added or none.")
    public String addDataObjectProps(@P("Name of the data object") String objectName,
                                     @P("Properties to append") List<Map<String, Object>> props) {
        ObjectNode args = args().put("objectName", objectName);
        ArrayNode list = args.putArray("props");
        if (props != null) {
            props.forEach(prop -> list.add(toNode(prop)));
        }
        return command("add_data_object_props", args);
    }

    @Tool(name = "update_data_object_prop", value = "Merge attributes into a data object property. The property name cannot be changed.")
    public String updateDataObjectProp(@P("Name of the data object") String objectName,
                                       @P("Name of the property") String propName,
                                       @P("Attributes to set on the property") Map<String, Object> updateFields) {
        ObjectNode args = args().put("objectName", objectName).put("propName", propName);
        args.set("updateFields", toNode(updateFields));
        return command("update_data_object_prop", args);
    }

    @Tool(name = "move_data_object_prop", value = "Move a data object property to a new 0-based position")
    public String moveDataObjectProp(@P("Name of the data object") String objectName,
                                     @P("Name of the property") String propName,
                                     @P("Target position, 0-based") Integer newPosition) {
        ObjectNode args = args().put("objectName", objectName).put("propName", propName);
        args.put("new_position", newPosition);
        return command("move_data_object_prop", args);
    }

    @Tool(name = "get_data_object_schema", value = "Describe the attributes of a data object and its properties, "
            + "including the allowed data types")
    public String getDataObjectSchema() {
        return schema("data_object");
    }

    @Tool(name = "get_data_object_summary_schema", value = "Describe the entries returned by list_data_objects")
    public String getDataObjectSummarySchema() {
        return schema("data_object_summary");
    }
}
