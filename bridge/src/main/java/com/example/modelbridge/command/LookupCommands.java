package com.example.modelbridge.command;

import com.example.modelbridge.command.args.AddLookupValueArgs;
import com.example.modelbridge.command.args.MoveLookupValueArgs;
import com.example.modelbridge.command.args.UpdateLookupValueArgs;
import com.example.modelbridge.document.ChildCollection;
import com.example.modelbridge.document.ModelKeys;
import com.example.modelbridge.document.ModelNodes;
import com.example.modelbridge.resolve.EntityResolver;
import com.example.modelbridge.resolve.ResolvedEntity;
import com.example.modelbridge.validation.MutationValidationException;
import lombok.RequiredArgsConstructor;
import tools.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Commands editing the values of lookup objects.
 */
@RequiredArgsConstructor
public class LookupCommands implements CommandGroup {

    private final EntityResolver resolver;
    private final ChildItemOperations childItems;

    @Override
    public List<CommandDefinition<?>> commands() {
        return List.of(
                CommandDefinition.mutation("add_lookup_value",
                        "Append a value to a lookup object", AddLookupValueArgs.class, this::add),
                CommandDefinition.mutation("update_lookup_value",
                        "Merge fields into a lookup value", UpdateLookupValueArgs.class, this::update),
                CommandDefinition.mutation("move_lookup_value",
                        "Move a lookup value to a new 0-based position", MoveLookupValueArgs.class, this::move)
        );
    }

    ObjectNode add(AddLookupValueArgs args) {
        ResolvedEntity lookup = lookupObject(args.lookupObjectName());
        ObjectNode value = args.lookupValue().deepCopy();
        String name = ModelNodes.name(value);
        if (!value.has("displayName") && !ModelNodes.isBlank(name)) {
            value.put("displayName", name);
        }
        if (!value.has("isActive")) {
            value.put("isActive", ModelKeys.TRUE);
        }
        return childItems.add(ChildCollection.LOOKUP_ITEM, lookup, value, "lookup_value");
    }

    ObjectNode update(UpdateLookupValueArgs args) {
        ResolvedEntity lookup = lookupObject(args.lookupObjectName());
        return childItems.update(ChildCollection.LOOKUP_ITEM, lookup, args.lookupValueName(), args.updates(), "updates");
    }

    ObjectNode move(MoveLookupValueArgs args) {
        ResolvedEntity lookup = lookupObject(args.lookupObjectName());
        return childItems.move(ChildCollection.LOOKUP_ITEM, lookup, args.lookupValueName(), args.newPosition());
    }

    private ResolvedEntity lookupObject(String name) {
        ResolvedEntity object = resolver.resolveObject(name).orElseThrow();
        if (!ModelNodes.isTrue(object.node(), ModelKeys.IS_LOOKUP)) {
            throw new MutationValidationException("lookup_object_name",
                    "data object '" + name + "' is not a lookup object (isLookup is not \"true\")");
        }
        return object;
    }
}
