package com.example.modelbridge.query;

import com.example.modelbridge.document.ModelKeys;
import com.example.modelbridge.document.WorkflowKind;
import com.example.modelbridge.validation.MutationValidator;
import lombok.RequiredArgsConstructor;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Static descriptions of the model's entity kinds: their attributes, the attributes' types and
 * allowed values, and notes on how the bridge treats them. Agents read these before building
 * mutation arguments.
 */
@RequiredArgsConstructor
public class ModelSchemas {

    /** Kind label used when a schema is requested that does not exist. */
    public static final String SCHEMA = "schema";

    private static final String PASCAL_CASE = "^[A-Z][A-Za-z0-9]*$";
    private static final String FLAG = "\"true\" or \"false\" (string)";

    private final JsonMapper jsonMapper;

    /** Names of every schema, each with its one-line description. */
    public ArrayNode kinds() {
        ArrayNode kinds = jsonMapper.createArrayNode();
        definitions().forEach((kind, definition) -> {
            ObjectNode entry = kinds.addObject();
            entry.put("kind", kind);
            entry.put("description", definition.get("description").stringValue());
        });
        return kinds;
    }

    public Optional<ObjectNode> schema(String kind) {
        if (kind == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(definitions().get(kind.trim().toLowerCase(Locale.ROOT)));
    }

    private Map<String, ObjectNode> definitions() {
        Map<String, ObjectNode> definitions = new LinkedHashMap<>();
        definitions.put("data_object", dataObject());
        definitions.put("data_object_summary", dataObjectSummary());
        definitions.put("lookup_value", lookupValue());
        definitions.put("role", role());
        definitions.put("user_story", userStory());
        definitions.put("form", form());
        definitions.put("report", report());
        definitions.put("general_flow", generalFlow());
        definitions.put("page_init_flow", pageInitFlow());
        definitions.put("workflow", workflow());
        return definitions;
    }

    private ObjectNode dataObject() {
        return schema("data_object", "A data object (table) of the model with its properties and lookup values", props -> {
            required(props, ModelKeys.NAME, "string", "Unique object name, compared case-insensitively").put("pattern", PASCAL_CASE);
            required(props, ModelKeys.PARENT_OBJECT_NAME, "string", "Exact name of the owning data object");
            flag(props, ModelKeys.IS_LOOKUP, "Lookup objects must have parent '" + ModelKeys.ROOT_OBJECT_NAME + "'");
            optional(props, ModelKeys.CODE_DESCRIPTION, "string", "Free text description");
            ObjectNode prop = optional(props, ModelKeys.PROP, "array", "Ordered properties of the object");
            ObjectNode propFields = prop.putObject("items").putObject("properties");
            required(propFields, ModelKeys.NAME, "string", "Property name, unique within the object").put("pattern", PASCAL_CASE);
            enumerated(propFields, ModelKeys.DATA_TYPE, MutationValidator.VALID_DATA_TYPES, "SQL Server column type");
            optional(propFields, "sqlServerDBDataTypeSize", "string", "Column size, e.g. \"100\" or \"18,2\"");
            flag(propFields, ModelKeys.IS_FK, "Whether the property references another data object");
            optional(propFields, ModelKeys.FK_OBJECT_NAME, "string", "Referenced data object; required when isFK is \"true\"");
            optional(props, ModelKeys.LOOKUP_ITEM, "array", "Values of a lookup object, see the lookup_value schema");
        }, "Object names must be unique across the whole model.",
                "Properties keep their order; move_data_object_prop changes it.");
    }

    private ObjectNode dataObjectSummary() {
        return schema("data_object_summary", "One entry of the data object list", props -> {
            required(props, ModelKeys.NAME, "string", "Object name");
            required(props, ModelKeys.IS_LOOKUP, "boolean", "Whether the object is a lookup");
            optional(props, ModelKeys.PARENT_OBJECT_NAME, "string", "Owning data object, null at the root");
            optional(props, ModelKeys.CODE_DESCRIPTION, "string", "Free text description");
            required(props, "propCount", "integer", "Number of properties");
        }, "Listing filters: search_name (ignores case and spaces), is_lookup, parent_object_name.");
    }

    private ObjectNode lookupValue() {
        return schema("lookup_value", "A value of a lookup object", props -> {
            required(props, ModelKeys.NAME, "string", "Value name, unique within the lookup object").put("pattern", PASCAL_CASE);
            optional(props, "displayName", "string", "Text shown to users, defaults to the name");
            optional(props, "description", "string", "Longer description");
            flag(props, "isActive", "Defaults to \"true\"");
        }, "Only objects with isLookup \"true\" hold lookup values.");
    }

    private ObjectNode role() {
        ObjectNode schema = schema("role", "A user role: a lookup value of the '" + ModelKeys.ROLE_OBJECT_NAME + "' object", props -> {
            required(props, ModelKeys.NAME, "string", "Role name").put("pattern", PASCAL_CASE);
            optional(props, "displayName", "string", "Defaults to the name split into words");
            optional(props, "description", "string", "Defaults to the name split into words");
            flag(props, "isActive", "Defaults to \"true\"");
        }, "add_role fails when the model has no '" + ModelKeys.ROLE_OBJECT_NAME + "' data object.",
                "User stories and forms reference roles by name.");
        schema.put("objectName", ModelKeys.ROLE_OBJECT_NAME);
        schema.put("isLookupObject", true);
        return schema;
    }

    private ObjectNode userStory() {
        ObjectNode schema = schema("user_story", "A user story of the first namespace", props -> {
            required(props, ModelKeys.NAME, "string", "Generated unique id of the story");
            required(props, "storyNumber", "string", "Positive integer, unique among stories");
            required(props, "storyText", "string", "\"A [Role] wants to view all X in the Y\" or \"As a Role, I want to ...\"");
            flag(props, "isIgnored", "Ignored stories are skipped by downstream tooling");
        }, "The role named in the text must be a value of the '" + ModelKeys.ROLE_OBJECT_NAME + "' lookup when that object exists.",
                "Data objects named in the text must exist in the model.",
                "Story text is unique, compared case-insensitively.");
        ObjectNode example = schema.putObject("example");
        example.put("storyNumber", "1");
        example.put("storyText", "A Manager wants to view all customers in the application");
        example.put("isIgnored", ModelKeys.FALSE);
        return schema;
    }

    private ObjectNode form() {
        return workflowSchema(WorkflowKind.FORM, "An input page bound to an owner data object", props -> {
            flag(props, ModelKeys.IS_PAGE, "Always \"true\" for forms");
            required(props, ModelKeys.TITLE_TEXT, "string", "Page title, at most 100 characters");
            optional(props, ModelKeys.ROLE_REQUIRED, "string", "Role allowed to open the form");
            optional(props, ModelKeys.TARGET_CHILD_OBJECT, "string", "Data object the form creates, if any");
            optional(props, ModelKeys.INIT_OBJECT_WORKFLOW_NAME, "string", "Page init flow run before display");
            children(props, ModelKeys.WORKFLOW_PARAM, "Ordered input controls");
            children(props, ModelKeys.WORKFLOW_BUTTON, "Ordered buttons, named by buttonName");
            children(props, ModelKeys.WORKFLOW_OUTPUT_VAR, "Ordered output variables");
        }, "Creating a form also creates its '" + WorkflowKind.FORM_INIT_SUFFIX + "' page init flow.");
    }

    private ObjectNode report() {
        return workflowSchema(WorkflowKind.REPORT, "A list or chart page bound to an owner data object", props -> {
            required(props, ModelKeys.TITLE_TEXT, "string", "Page title, at most 100 characters");
            enumerated(props, ModelKeys.VISUALIZATION_TYPE, MutationValidator.VALID_VISUALIZATION_TYPES, "How rows are shown");
            optional(props, ModelKeys.ROLE_REQUIRED, "string", "Role allowed to open the report");
            optional(props, ModelKeys.TARGET_CHILD_OBJECT, "string", "Data object listed by the report");
            children(props, ModelKeys.REPORT_PARAM, "Ordered filter inputs");
            children(props, ModelKeys.REPORT_COLUMN, "Ordered columns");
            children(props, ModelKeys.REPORT_BUTTON, "Ordered buttons, named by buttonName");
        }, "Creating a report also creates its '" + WorkflowKind.REPORT_INIT_SUFFIX + "' page init flow.");
    }

    private ObjectNode generalFlow() {
        return workflowSchema(WorkflowKind.GENERAL_FLOW, "A background flow without a page", props -> {
            flag(props, ModelKeys.IS_PAGE, "Always \"false\" for general flows");
            children(props, ModelKeys.WORKFLOW_PARAM, "Ordered inputs");
            children(props, ModelKeys.WORKFLOW_OUTPUT_VAR, "Ordered output variables");
        }, "Names must not end with '" + WorkflowKind.FORM_INIT_SUFFIX + "' or '" + WorkflowKind.REPORT_INIT_SUFFIX + "'.");
    }

    private ObjectNode pageInitFlow() {
        return workflowSchema(WorkflowKind.PAGE_INIT_FLOW, "A flow run before a form or report is shown", props ->
                        children(props, ModelKeys.WORKFLOW_OUTPUT_VAR, "Ordered output variables; defaultValue and foreign key fields are not supported"),
                "Names end with '" + WorkflowKind.FORM_INIT_SUFFIX + "' or '" + WorkflowKind.REPORT_INIT_SUFFIX + "'.");
    }

    private ObjectNode workflow() {
        return workflowSchema(WorkflowKind.DYNA_FLOW, "A DynaFlow workflow or workflow task", props -> {
            flag(props, ModelKeys.IS_DYNA_FLOW, "Set on DynaFlow workflows");
            flag(props, ModelKeys.IS_DYNA_FLOW_TASK, "Set on DynaFlow tasks");
        }, "DynaFlow workflows are read-only through the bridge.");
    }

    private ObjectNode workflowSchema(WorkflowKind kind, String description, Consumer<ObjectNode> properties, String... notes) {
        ObjectNode schema = schema(kind.label(), description, props -> {
            required(props, ModelKeys.NAME, "string", "Unique among all forms, reports and flows, compared case-insensitively")
                    .put("pattern", PASCAL_CASE);
            properties.accept(props);
        }, notes);
        schema.put("ownerList", kind.listKey());
        return schema;
    }

    private ObjectNode schema(String objectType, String description, Consumer<ObjectNode> properties, String... notes) {
        ObjectNode schema = jsonMapper.createObjectNode();
        schema.put("type", "object");
        schema.put("description", description);
        schema.put("objectType", objectType);
        properties.accept(schema.putObject("properties"));
        ArrayNode noteList = schema.putArray("notes");
        noteList.add("Attribute values are strings; flags are " + FLAG + ".");
        for (String note : notes) {
            noteList.add(note);
        }
        return schema;
    }

    private static ObjectNode required(ObjectNode props, String name, String type, String description) {
        ObjectNode property = optional(props, name, type, description);
        property.put("required", true);
        return property;
    }

    private static ObjectNode optional(ObjectNode props, String name, String type, String description) {
        ObjectNode property = props.putObject(name);
        property.put("type", type);
        property.put("required", false);
        property.put("description", description);
        return property;
    }

    private static void flag(ObjectNode props, String name, String description) {
        ObjectNode property = optional(props, name, "string", description);
        ArrayNode values = property.putArray("enum");
        values.add(ModelKeys.TRUE);
        values.add(ModelKeys.FALSE);
    }

    private static void enumerated(ObjectNode props, String name, Collection<String> allowed, String description) {
        ObjectNode property = optional(props, name, "string", description);
        ArrayNode values = property.putArray("enum");
        new TreeSet<>(allowed).forEach(values::add);
    }

    private static void children(ObjectNode props, String listKey, String description) {
        optional(props, listKey, "array", description);
    }
}
