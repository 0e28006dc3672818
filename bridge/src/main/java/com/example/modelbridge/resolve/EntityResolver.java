package com.example.modelbridge.resolve;

import com.example.modelbridge.document.ChildCollection;
import com.example.modelbridge.document.ModelDocumentStore;
import com.example.modelbridge.document.ModelKeys;
import com.example.modelbridge.document.ModelNodes;
import com.example.modelbridge.document.WorkflowKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Locates named entities in the model tree.
 * <p>
 * Data objects match by exact, case-sensitive name. Workflows, reports and child elements match
 * case-insensitively. Without an owner hint the first match in tree order wins, and every owner
 * holding the name is reported as a candidate so callers can detect ambiguity.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class EntityResolver {

    public static final String DATA_OBJECT = "data object";

    private final ModelDocumentStore store;

    public Resolution resolveObject(String name) {
        for (ObjectNode namespace : store.namespaces()) {
            ArrayNode objects = listOf(namespace, ModelKeys.OBJECT);
            if (objects == null) {
                continue;
            }
            for (int i = 0; i < objects.size(); i++) {
                JsonNode candidate = objects.get(i);
                if (candidate.isObject() && ModelNodes.text(candidate, ModelKeys.NAME).equals(name)) {
                    ObjectNode object = (ObjectNode) candidate;
                    return Resolution.found(DATA_OBJECT, name, null,
                            new ResolvedEntity(object, objects, i, object, null, List.of(name)));
                }
            }
        }
        return Resolution.notFound(DATA_OBJECT, name, null);
    }

    /**
     * Loose lookup used for filters and owner hints: exact match first, then case-insensitive
     * with whitespace removed.
     */
    public Optional<ObjectNode> findObject(String name) {
        if (ModelNodes.isBlank(name)) {
            return Optional.empty();
        }
        Resolution exact = resolveObject(name);
        if (exact.isFound()) {
            return Optional.of(exact.entity().node());
        }
        String wanted = ModelNodes.normalize(name);
        return store.allObjects().stream()
                .filter(o -> ModelNodes.normalize(ModelNodes.name(o)).equals(wanted))
                .findFirst();
    }

    public boolean objectExists(String name) {
        return resolveObject(name).isFound();
    }

    /**
     * Resolves a form, report, general flow or page init flow by name.
     *
     * @param ownerHint optional owning data object; when given only that object is searched
     */
    public Resolution resolveWorkflow(WorkflowKind kind, String name, String ownerHint) {
        List<ObjectNode> owners;
        String scope = null;
        if (!ModelNodes.isBlank(ownerHint)) {
            Optional<ObjectNode> owner = findObject(ownerHint);
            scope = DATA_OBJECT + " '" + ownerHint + "'";
            if (owner.isEmpty()) {
                return Resolution.notFound(kind.label(), name, scope);
            }
            owners = List.of(owner.get());
        } else {
            owners = store.allObjects();
        }

        ResolvedEntity first = null;
        List<String> candidates = new ArrayList<>();
        for (ObjectNode owner : owners) {
            ArrayNode list = listOf(owner, kind.listKey());
            if (list == null) {
                continue;
            }
            for (int i = 0; i < list.size(); i++) {
                JsonNode element = list.get(i);
                if (!element.isObject()) {
                    continue;
                }
                ObjectNode workflow = (ObjectNode) element;
                if (kind.matches(workflow) && ModelNodes.sameNameIgnoreCase(ModelNodes.name(workflow), name)) {
                    if (first == null) {
                        first = new ResolvedEntity(workflow, list, i, owner, null, List.of());
                    }
                    candidates.add(ModelNodes.name(owner));
                    break;
                }
            }
        }
        if (first == null) {
            return Resolution.notFound(kind.label(), name, scope);
        }
        if (candidates.size() > 1) {
            log.debug("Ambiguous {} name={} owners={}", kind.label(), name, candidates);
        }
        return Resolution.found(kind.label(), name, scope, new ResolvedEntity(
                first.node(), first.parentList(), first.index(), first.ownerObject(), null, candidates));
    }

    /**
     * Resolves an element of an ordered child list inside an already resolved container.
     */
    public Resolution resolveChild(ChildCollection collection, ResolvedEntity container, String itemName) {
        String scope = collection.isObjectLevel()
                ? DATA_OBJECT + " '" + container.ownerObjectName() + "'"
                : collection.workflowKind().label() + " '" + ModelNodes.name(container.node()) + "'";
        ArrayNode list = listOf(container.node(), collection.listKey());
        if (list != null) {
            for (int i = 0; i < list.size(); i++) {
                JsonNode element = list.get(i);
                if (element.isObject()
                        && ModelNodes.sameNameIgnoreCase(ModelNodes.text(element, collection.nameField()), itemName)) {
                    ObjectNode ownerWorkflow = collection.isObjectLevel() ? null : container.node();
                    return Resolution.found(collection.label(), itemName, scope, new ResolvedEntity(
                            (ObjectNode) element, list, i, container.ownerObject(), ownerWorkflow,
                            List.of(container.ownerObjectName())));
                }
            }
        }
        return Resolution.notFound(collection.label(), itemName, scope);
    }

    /**
     * True when any form, report or flow in the model has this name, compared case-insensitively.
     */
    public boolean workflowNameExists(String name) {
        for (ObjectNode object : store.allObjects()) {
            for (String key : List.of(ModelKeys.OBJECT_WORKFLOW, ModelKeys.REPORT)) {
                for (ObjectNode workflow : store.children(object, key)) {
                    if (ModelNodes.sameNameIgnoreCase(ModelNodes.name(workflow), name)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private static ArrayNode listOf(ObjectNode owner, String key) {
        JsonNode list = owner.get(key);
        return list != null && list.isArray() ? (ArrayNode) list : null;
    }
}
