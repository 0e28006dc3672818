package com.example.modelbridge.query;

import com.example.modelbridge.document.ModelDocumentStore;
import com.example.modelbridge.document.ModelKeys;
import com.example.modelbridge.document.ModelNodes;
import com.example.modelbridge.document.WorkflowKind;
import com.example.modelbridge.resolve.EntityResolver;
import com.example.modelbridge.resolve.Resolution;
import com.example.modelbridge.resolve.ResolvedEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only projections of the model served by the data channel. Queries never mutate the document;
 * returned nodes are copies.
 */
@Slf4j
@RequiredArgsConstructor
public class ModelQueries {

    public static final String OWNER_FIELD = "_ownerObjectName";

    private final JsonMapper jsonMapper;
    private final ModelDocumentStore store;
    private final EntityResolver resolver;
    private final DataObjectUsageAnalyzer usageAnalyzer;

    public ObjectNode model() {
        return store.root().deepCopy();
    }

    public ArrayNode objects() {
        ArrayNode objects = jsonMapper.createArrayNode();
        store.allObjects().forEach(o -> objects.add(o.deepCopy()));
        return objects;
    }

    /**
     * Data object summaries.
     *
     * @param searchName       optional, case-insensitive substring of the name (whitespace ignored)
     * @param isLookup         optional, {@code "true"} or {@code "false"}
     * @param parentObjectName optional, case-insensitive parent name
     */
    public ArrayNode dataObjectSummaries(String searchName, String isLookup, String parentObjectName) {
        String search = ModelNodes.normalize(searchName);
        String parent = ModelNodes.normalize(parentObjectName);
        ArrayNode summaries = jsonMapper.createArrayNode();
        for (ObjectNode object : store.allObjects()) {
            String name = ModelNodes.name(object);
            if (!search.isEmpty() && !ModelNodes.normalize(name).contains(search)) {
                continue;
            }
            if (!ModelNodes.isBlank(isLookup)
                    && ModelNodes.isTrue(object, ModelKeys.IS_LOOKUP) != Boolean.parseBoolean(isLookup.trim())) {
                continue;
            }
            if (!parent.isEmpty() && !ModelNodes.normalize(ModelNodes.text(object, ModelKeys.PARENT_OBJECT_NAME)).equals(parent)) {
                continue;
            }
            summaries.addObject()
                    .put("name", name)
                    .put("isLookup", ModelNodes.isTrue(object, ModelKeys.IS_LOOKUP) ? ModelKeys.TRUE : ModelKeys.FALSE)
                    .put("parentObjectName", ModelNodes.text(object, ModelKeys.PARENT_OBJECT_NAME))
                    .put("codeDescription", ModelNodes.text(object, ModelKeys.CODE_DESCRIPTION))
                    .put("propCount", store.children(object, ModelKeys.PROP).size());
        }
        log.debug("Data object summaries search={} isLookup={} parent={} count={}", searchName, isLookup,
                parentObjectName, summaries.size());
        return summaries;
    }

    /** One data object by name: exact first, then case-insensitive with whitespace removed. */
    public Optional<ObjectNode> dataObject(String name) {
        return resolver.findObject(name).map(ObjectNode::deepCopy);
    }

    public ArrayNode usageSummary() {
        return usageAnalyzer.summary();
    }

    public Optional<ObjectNode> usage(String objectName) {
        return resolver.findObject(objectName).map(object -> {
            String name = ModelNodes.name(object);
            ArrayNode references = usageAnalyzer.references(name);
            ObjectNode usage = jsonMapper.createObjectNode();
            usage.put("dataObjectName", name);
            usage.put("totalReferences", references.size());
            usage.set("references", references);
            return usage;
        });
    }

    /**
     * Workflows of one kind, each tagged with its owner. A name filter without an owner filter returns
     * the match of every owner, so a name held by several owners shows up once per owner.
     */
    public ArrayNode workflows(WorkflowKind kind, String nameFilter, String ownerFilter) {
        ArrayNode result = jsonMapper.createArrayNode();
        List<ObjectNode> owners;
        if (ModelNodes.isBlank(ownerFilter)) {
            owners = store.allObjects();
        } else {
            owners = resolver.findObject(ownerFilter).map(List::of).orElse(List.of());
        }
        for (ObjectNode owner : owners) {
            for (ObjectNode workflow : store.children(owner, kind.listKey())) {
                if (!kind.matches(workflow)) {
                    continue;
                }
                if (!ModelNodes.isBlank(nameFilter)
                        && !ModelNodes.normalize(ModelNodes.name(workflow)).equals(ModelNodes.normalize(nameFilter))) {
                    continue;
                }
                ObjectNode item = workflow.deepCopy();
                item.put(OWNER_FIELD, ModelNodes.name(owner));
                result.add(item);
            }
        }
        log.debug("Listed {} name={} owner={} count={}", kind.label(), nameFilter, ownerFilter, result.size());
        return result;
    }

    /**
     * Lookup values of one lookup object, or of every lookup object (each tagged with its owner) when
     * no name is given.
     */
    public Optional<ArrayNode> lookupValues(String lookupObjectName) {
        ArrayNode values = jsonMapper.createArrayNode();
        if (!ModelNodes.isBlank(lookupObjectName)) {
            Optional<ObjectNode> object = resolver.findObject(lookupObjectName);
            if (object.isEmpty()) {
                return Optional.empty();
            }
            store.children(object.get(), ModelKeys.LOOKUP_ITEM).forEach(item -> values.add(item.deepCopy()));
            return Optional.of(values);
        }
        for (ObjectNode object : store.allObjects()) {
            if (!ModelNodes.isTrue(object, ModelKeys.IS_LOOKUP)) {
                continue;
            }
            for (ObjectNode item : store.children(object, ModelKeys.LOOKUP_ITEM)) {
                ObjectNode copy = item.deepCopy();
                copy.put(OWNER_FIELD, ModelNodes.name(object));
                values.add(copy);
            }
        }
        return Optional.of(values);
    }

    /** Lookup values of the {@code Role} object, sorted by name; empty when the model has no roles. */
    public ArrayNode roles() {
        ArrayNode roles = jsonMapper.createArrayNode();
        resolver.findObject(ModelKeys.ROLE_OBJECT_NAME).ifPresent(role -> store.children(role, ModelKeys.LOOKUP_ITEM)
                .stream()
                .sorted(Comparator.comparing(ModelNodes::name, String.CASE_INSENSITIVE_ORDER))
                .forEach(item -> roles.add(item.deepCopy())));
        return roles;
    }

    public ArrayNode userStories() {
        ArrayNode stories = jsonMapper.createArrayNode();
        for (ObjectNode namespace : store.namespaces()) {
            store.children(namespace, ModelKeys.USER_STORY).forEach(story -> stories.add(story.deepCopy()));
        }
        return stories;
    }

    /**
     * The resolver's view of a name: the first tree-order match plus every candidate owner, so callers
     * can see when a name without owner hint is ambiguous.
     *
     * @param kind {@code data_object}, {@code form}, {@code report}, {@code general_flow} or {@code page_init_flow}
     */
    public Resolution resolve(String kind, String name, String ownerHint) {
        if ("data_object".equals(kind)) {
            return resolver.resolveObject(name);
        }
        return resolver.resolveWorkflow(parseKind(kind), name, ownerHint);
    }

    public ObjectNode describe(Resolution resolution) {
        ResolvedEntity entity = resolution.orElseThrow();
        ObjectNode result = jsonMapper.createObjectNode();
        result.put("found", true);
        result.put("kind", resolution.kind());
        result.put("name", ModelNodes.name(entity.node()));
        result.put("ownerObjectName", entity.ownerObjectName());
        result.put("position", entity.index());
        result.put("ambiguous", entity.isAmbiguous());
        ArrayNode candidates = result.putArray("candidates");
        entity.candidates().forEach(candidates::add);
        result.set("entity", entity.node().deepCopy());
        return result;
    }

    private static WorkflowKind parseKind(String kind) {
        for (WorkflowKind candidate : WorkflowKind.values()) {
            if (candidate.name().equalsIgnoreCase(kind)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown entity kind '" + kind
                + "'; expected data_object, form, report, general_flow or page_init_flow");
    }
}
