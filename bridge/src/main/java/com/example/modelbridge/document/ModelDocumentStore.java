package com.example.modelbridge.document;

import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Owner of the canonical in-memory model document.
 * <p>
 * All writes go through the mutation primitives below, and composite writes through
 * {@link #applyAtomically(String, Supplier)}, which restores the previous tree when the change fails.
 * The store is not thread-safe; the bridge serializes every access on one event thread.
 * </p>
 */
@Slf4j
public class ModelDocumentStore {

    public static final String UNTITLED = "untitled";

    private final JsonMapper jsonMapper;
    private ObjectNode root;
    private String documentName;
    private boolean dirty;
    private Instant lastModified;

    public ModelDocumentStore(JsonMapper jsonMapper) {
        this.jsonMapper = Objects.requireNonNull(jsonMapper, "jsonMapper");
        open(emptyModel(), UNTITLED);
    }

    /**
     * Replaces the held document. The new document starts clean.
     */
    public void open(ObjectNode document, String name) {
        Objects.requireNonNull(document, "document");
        if (!document.has(ModelKeys.NAMESPACE) || !document.get(ModelKeys.NAMESPACE).isArray()) {
            throw new IllegalArgumentException("Model document must have a '" + ModelKeys.NAMESPACE + "' array");
        }
        this.root = document;
        this.documentName = name != null ? name : UNTITLED;
        this.dirty = false;
        this.lastModified = Instant.now();
        log.info("Opened model document name={} objects={}", documentName, allObjects().size());
    }

    /** A model with one namespace holding the root {@code Pac} object. */
    public ObjectNode emptyModel() {
        ObjectNode model = jsonMapper.createObjectNode();
        ObjectNode namespace = model.putArray(ModelKeys.NAMESPACE).addObject();
        namespace.put(ModelKeys.NAME, "Default");
        ObjectNode pac = namespace.putArray(ModelKeys.OBJECT).addObject();
        pac.put(ModelKeys.NAME, ModelKeys.ROOT_OBJECT_NAME);
        pac.put(ModelKeys.IS_LOOKUP, ModelKeys.FALSE);
        pac.putArray(ModelKeys.PROP);
        namespace.putArray(ModelKeys.USER_STORY);
        return model;
    }

    public ObjectNode root() {
        return root;
    }

    public String documentName() {
        return documentName;
    }

    public boolean isDirty() {
        return dirty;
    }

    public Instant lastModified() {
        return lastModified;
    }

    /** Clears the dirty flag after an external save. */
    void markSaved() {
        dirty = false;
    }

    public List<ObjectNode> namespaces() {
        return objectsOf(root.get(ModelKeys.NAMESPACE));
    }

    /** All data objects across namespaces, in tree order. */
    public List<ObjectNode> allObjects() {
        List<ObjectNode> objects = new ArrayList<>();
        for (ObjectNode namespace : namespaces()) {
            objects.addAll(objectsOf(namespace.get(ModelKeys.OBJECT)));
        }
        return objects;
    }

    /** Elements of {@code owner[key]} that are objects; empty when the list is missing. */
    public List<ObjectNode> children(ObjectNode owner, String key) {
        return objectsOf(owner.get(key));
    }

    /** Returns {@code owner[key]}, creating an empty list when missing. */
    public ArrayNode ensureList(ObjectNode owner, String key) {
        JsonNode existing = owner.get(key);
        if (existing != null && existing.isArray()) {
            return (ArrayNode) existing;
        }
        return owner.putArray(key);
    }

    public ObjectNode insert(ArrayNode list, ObjectNode entity) {
        list.add(entity);
        return entity;
    }

    public ObjectNode insert(ArrayNode list, int index, ObjectNode entity) {
        list.insert(index, entity);
        return entity;
    }

    /**
     * Copies {@code fields} onto {@code entity}, skipping the names in {@code protectedFields}.
     */
    public ObjectNode update(ObjectNode entity, ObjectNode fields, String... protectedFields) {
        List<String> skip = List.of(protectedFields);
        for (Map.Entry<String, JsonNode> field : fields.properties()) {
            if (!skip.contains(field.getKey())) {
                entity.set(field.getKey(), field.getValue());
            }
        }
        return entity;
    }

    public ObjectNode remove(ArrayNode list, int index) {
        return (ObjectNode) list.remove(index);
    }

    /**
     * Runs {@code change} against the live tree. If it throws, the tree is restored to its state
     * before the call and the exception propagates; otherwise the document is marked dirty.
     */
    public <T> T applyAtomically(String description, Supplier<T> change) {
        ObjectNode snapshot = root.deepCopy();
        boolean wasDirty = dirty;
        try {
            T result = change.get();
            dirty = true;
            lastModified = Instant.now();
            log.debug("Applied change: {}", description);
            return result;
        } catch (RuntimeException e) {
            root = snapshot;
            dirty = wasDirty;
            log.debug("Rolled back change: {} ({})", description, e.getMessage());
            throw e;
        }
    }

    private static List<ObjectNode> objectsOf(JsonNode list) {
        List<ObjectNode> result = new ArrayList<>();
        if (list != null && list.isArray()) {
            for (JsonNode element : list) {
                if (element.isObject()) {
                    result.add((ObjectNode) element);
                }
            }
        }
        return result;
    }
}
