package com.example.modelbridge.resolve;

import com.example.modelbridge.document.ModelNodes;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;

/**
 * A resolved node together with its owning chain.
 *
 * @param node          the entity itself
 * @param parentList    the list holding the entity
 * @param index         position of the entity in {@code parentList}
 * @param ownerObject   data object owning the entity (the entity itself for data objects)
 * @param ownerWorkflow form, report or flow owning the entity; {@code null} unless the entity is a workflow child
 * @param candidates    names of every owner holding an entity of this name; more than one means ambiguous
 */
public record ResolvedEntity(
        ObjectNode node,
        ArrayNode parentList,
        int index,
        ObjectNode ownerObject,
        ObjectNode ownerWorkflow,
        List<String> candidates
) {
    public ResolvedEntity {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(parentList, "parentList");
        Objects.requireNonNull(ownerObject, "ownerObject");
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public String ownerObjectName() {
        return ModelNodes.name(ownerObject);
    }

    public boolean isAmbiguous() {
        return candidates.size() > 1;
    }
}
