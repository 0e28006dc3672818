package com.example.modelbridge.command;

import com.example.modelbridge.command.args.AddRoleArgs;
import com.example.modelbridge.command.args.UpdateRoleArgs;
import com.example.modelbridge.document.ChildCollection;
import com.example.modelbridge.document.ModelKeys;
import com.example.modelbridge.document.ModelNodes;
import com.example.modelbridge.resolve.EntityResolver;
import com.example.modelbridge.resolve.ResolvedEntity;
import lombok.RequiredArgsConstructor;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Roles are the lookup values of the {@code Role} data object.
 */
@RequiredArgsConstructor
public class RoleCommands implements CommandGroup {

    private final JsonMapper jsonMapper;
    private final EntityResolver resolver;
    private final ChildItemOperations childItems;

    @Override
    public List<CommandDefinition<?>> commands() {
        return List.of(
                CommandDefinition.mutation("add_role",
                        "Add a role to the Role lookup object", AddRoleArgs.class, this::add),
                CommandDefinition.mutation("update_role",
                        "Change the displayName, description or isActive of a role", UpdateRoleArgs.class, this::update)
        );
    }

    ObjectNode add(AddRoleArgs args) {
        ResolvedEntity roleObject = roleObject();
        String words = ModelNodes.displayText(args.name());
        ObjectNode value = jsonMapper.createObjectNode();
        value.put(ModelKeys.NAME, args.name());
        value.put("displayName", args.displayName() != null ? args.displayName() : words);
        value.put("description", args.description() != null ? args.description() : words);
        value.put("isActive", args.isActive() != null ? args.isActive() : ModelKeys.TRUE);
        return childItems.add(ChildCollection.LOOKUP_ITEM, roleObject, value, "role");
    }

    ObjectNode update(UpdateRoleArgs args) {
        ResolvedEntity roleObject = roleObject();
        ObjectNode updates = jsonMapper.createObjectNode();
        if (args.displayName() != null) {
            updates.put("displayName", args.displayName());
        }
        if (args.description() != null) {
            updates.put("description", args.description());
        }
        if (args.isActive() != null) {
            updates.put("isActive", args.isActive());
        }
        return childItems.update(ChildCollection.LOOKUP_ITEM, roleObject, args.name(), updates, "role");
    }

    private ResolvedEntity roleObject() {
        return resolver.resolveObject(ModelKeys.ROLE_OBJECT_NAME).orElseThrow();
    }
}
