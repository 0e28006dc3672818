package com.example.modelbridge.command;

import com.example.modelbridge.document.ChildCollection;
import com.example.modelbridge.document.ModelDocumentStore;
import com.example.modelbridge.document.ModelNodes;
import com.example.modelbridge.reorder.MoveResult;
import com.example.modelbridge.reorder.ReorderEngine;
import com.example.modelbridge.resolve.EntityResolver;
import com.example.modelbridge.resolve.ResolvedEntity;
import com.example.modelbridge.validation.MutationValidator;
import com.example.modelbridge.validation.ValidationError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Add, update and move for elements of ordered child lists (properties, lookup values, parameters,
 * buttons, columns, output variables), shared by every command group.
 */
@Slf4j
@RequiredArgsConstructor
public class ChildItemOperations {

    private final JsonMapper jsonMapper;
    private final ModelDocumentStore store;
    private final EntityResolver resolver;
    private final MutationValidator validator;
    private final ReorderEngine reorderEngine;

    /**
     * Appends {@code item} to the container's list after validating its name and attributes.
     *
     * @param argument argument name used as the prefix of error fields
     */
    public ObjectNode add(ChildCollection collection, ResolvedEntity container, ObjectNode item, String argument) {
        String name = ModelNodes.text(item, collection.nameField());
        List<ValidationError> errors = new ArrayList<>();
        validator.checkSiblingName(collection, store.children(container.node(), collection.listKey()), null,
                name, argument + "." + collection.nameField(), errors);
        validator.checkUnsupportedFields(collection, item, argument, errors);
        validator.checkAttributes(item, argument, errors);
        MutationValidator.throwIfInvalid(errors);

        ObjectNode element = item.deepCopy();
        int count = store.applyAtomically("add " + collection.label() + " " + name, () -> {
            ArrayNode list = store.ensureList(container.node(), collection.listKey());
            store.insert(list, element);
            return list.size();
        });
        log.info("Added {} name={} to {} owner={}", collection.label(), name, containerName(container), container.ownerObjectName());

        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("message", "Added " + collection.label() + " '" + name + "' to '" + containerName(container) + "'");
        payload.put("name", name);
        payload.put("ownerObjectName", container.ownerObjectName());
        payload.put("position", count - 1);
        payload.put("count", count);
        payload.set("item", element);
        return payload;
    }

    /**
     * Merges {@code updates} into the named element. The element's name is never changed.
     */
    public ObjectNode update(ChildCollection collection, ResolvedEntity container, String itemName,
                             ObjectNode updates, String argument) {
        ResolvedEntity resolved = resolver.resolveChild(collection, container, itemName).orElseThrow();
        List<ValidationError> errors = new ArrayList<>();
        if (updates.isEmpty()) {
            errors.add(new ValidationError(argument, argument + " must contain at least one field"));
        }
        ObjectNode merged = resolved.node().deepCopy();
        store.update(merged, updates, collection.nameField());
        validator.checkUnsupportedFields(collection, updates, argument, errors);
        validator.checkEnumerations(updates, argument, errors);
        validator.checkForeignKey(merged, argument, errors);
        MutationValidator.throwIfInvalid(errors);

        String name = ModelNodes.text(resolved.node(), collection.nameField());
        store.applyAtomically("update " + collection.label() + " " + name,
                () -> store.update(resolved.node(), updates, collection.nameField()));
        List<String> updated = new ArrayList<>();
        updates.properties().forEach(field -> {
            if (!collection.nameField().equals(field.getKey())) {
                updated.add(field.getKey());
            }
        });
        log.info("Updated {} name={} in {} fields={}", collection.label(), name, containerName(container), updated);

        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("message", "Updated " + collection.label() + " '" + name + "' in '" + containerName(container) + "'");
        payload.put("name", name);
        payload.put("ownerObjectName", container.ownerObjectName());
        ArrayNode fields = payload.putArray("updatedFields");
        updated.forEach(fields::add);
        payload.set("item", resolved.node().deepCopy());
        return payload;
    }

    public ObjectNode move(ChildCollection collection, ResolvedEntity container, String itemName, int newPosition) {
        ResolvedEntity resolved = resolver.resolveChild(collection, container, itemName).orElseThrow();
        String name = ModelNodes.text(resolved.node(), collection.nameField());
        MoveResult result = store.applyAtomically("move " + collection.label() + " " + name,
                () -> reorderEngine.move(resolved, name, newPosition));
        log.info("Moved {} name={} in {} from={} to={}", collection.label(), name, containerName(container),
                result.oldPosition(), result.newPosition());

        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("message", "Moved " + collection.label() + " '" + name + "' from position "
                + result.oldPosition() + " to " + result.newPosition());
        payload.put("name", name);
        payload.put("ownerObjectName", container.ownerObjectName());
        payload.put("oldPosition", result.oldPosition());
        payload.put("newPosition", result.newPosition());
        payload.put("count", result.count());
        return payload;
    }

    private static String containerName(ResolvedEntity container) {
        return ModelNodes.name(container.node());
    }
}
