package com.example.agenttools.tools;

import com.example.agenttools.client.BridgeClient;
import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Tools for lookup values, roles and user stories.
 */
public class LookupTools extends BridgeTools {

    private static final String LOOKUP = "lookup_object_name";

    public LookupTools(BridgeClient client, JsonMapper jsonMapper) {
        super(client, jsonMapper);
    }

    @Tool(name = "list_lookup_values", value = "List the values of a lookup data object in their stored order")
    public String listLookupValues(@P("Name of the lookup data object, e.g. \"Role\"") String lookupObjectName) {
        return list("/api/lookup-values", filters(LOOKUP, lookupObjectName), "lookupValues",
                "Lookup values of '" + lookupObjectName + "'");
    }

    @Tool(name = "add_lookup_value", value = "Append a value to a lookup data object. displayName defaults to the name, "
            + "isActive to \"true\".")
    public String addLookupValue(@P("Name of the lookup data object") String lookupObjectName,
                                 @P("The value: PascalCase name plus optional displayName, description, isActive") Map<String, Object> lookupValue) {
        ObjectNode args = args().put(LOOKUP, lookupObjectName);
        args.set("lookup_value", toNode(lookupValue));
        return command("add_lookup_value", args);
    }

    @Tool(name = "update_lookup_value", value = "Merge attributes such as displayName or isActive into a lookup value")
    public String updateLookupValue(@P("Name of the lookup data object") String lookupObjectName,
                                    @P("Name of the lookup value") String lookupValueName,
                                    @P("Attributes to set") Map<String, Object> updates) {
        ObjectNode args = args().put(LOOKUP, lookupObjectName).put("lookup_value_name", lookupValueName);
        args.set("updates", toNode(updates));
        return command("update_lookup_value", args);
    }

    @Tool(name = "move_lookup_value", value = "Move a lookup value to a new 0-based position")
    public String moveLookupValue(@P("Name of the lookup data object") String lookupObjectName,
                                  @P("Name of the lookup value") String lookupValueName,
                                  @P("Target position, 0-based") Integer newPosition) {
        ObjectNode args = args().put(LOOKUP, lookupObjectName).put("lookup_value_name", lookupValueName);
        args.put("new_position", newPosition);
        return command("move_lookup_value", args);
    }

    @Tool(name = "list_roles", value = "List the values of the Role lookup, sorted by name")
    public String listRoles() {
        return list("/api/roles", Map.of(), "roles", "Values usable as roleRequired on forms and reports");
    }

    @Tool(name = "list_user_stories", value = "List all user stories")
    public String listUserStories() {
        return list("/api/user-stories", Map.of(), "userStories", "User stories of the model");
    }

    @Tool(name = "create_user_story", value = "Append a user story. Without a storyNumber the next free number is used.")
    public String createUserStory(@P("Story text, e.g. \"A User wants to add a Customer\"") String storyText,
                                  @P(value = "Story number; must not be used yet", required = false) String storyNumber) {
        ObjectNode args = args();
        putIfPresent(args, "storyText", storyText);
        putIfPresent(args, "storyNumber", storyNumber);
        return command("create_user_story", args);
    }

    @Tool(name = "add_role", value = "Add a role to the Role lookup. displayName and description default to the name "
            + "split into words, isActive to \"true\".")
    public String addRole(@P("PascalCase role name, e.g. \"SalesManager\"") String name,
                          @P(value = "Text shown to users", required = false) String displayName,
                          @P(value = "Longer description", required = false) String description,
                          @P(value = "\"true\" or \"false\"", required = false) String isActive) {
        return command("add_role", roleArgs(name, displayName, description, isActive));
    }

    @Tool(name = "update_role", value = "Change the displayName, description or isActive of a role")
    public String updateRole(@P("Name of the role") String name,
                             @P(value = "Text shown to users", required = false) String displayName,
                             @P(value = "Longer description", required = false) String description,
                             @P(value = "\"true\" or \"false\"", required = false) String isActive) {
        return command("update_role", roleArgs(name, displayName, description, isActive));
    }

    @Tool(name = "update_user_story", value = "Mark a user story as ignored or not. The story is found by its name (id).")
    public String updateUserStory(@P("The story's name, as returned by list_user_stories") String name,
                                  @P("\"true\" or \"false\"") String isIgnored) {
        ObjectNode args = args();
        putIfPresent(args, "name", name);
        putIfPresent(args, "isIgnored", isIgnored);
        return command("update_user_story", args);
    }

    @Tool(name = "get_lookup_value_schema", value = "Describe the attributes of a lookup value")
    public String getLookupValueSchema() {
        return schema("lookup_value");
    }

    @Tool(name = "get_role_schema", value = "Describe the attributes of a role in the Role lookup")
    public String getRoleSchema() {
        return schema("role");
    }

    @Tool(name = "get_user_story_schema", value = "Describe the attributes of a user story and the story text rules")
    public String getUserStorySchema() {
        return schema("user_story");
    }

    private ObjectNode roleArgs(String name, String displayName, String description, String isActive) {
        ObjectNode args = args();
        putIfPresent(args, "name", name);
        if (displayName != null) {
            args.put("displayName", displayName);
        }
        if (description != null) {
            args.put("description", description);
        }
        putIfPresent(args, "isActive", isActive);
        return args;
    }
}
