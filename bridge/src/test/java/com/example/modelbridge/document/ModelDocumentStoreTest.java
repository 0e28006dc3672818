package com.example.modelbridge.document;

import com.example.modelbridge.BridgeFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ModelDocumentStore")
class ModelDocumentStoreTest {

    private final JsonMapper jsonMapper = BridgeFixture.newJsonMapper();

    @Nested
    @DisplayName("opening documents")
    class Opening {

        @Test
        @DisplayName("starts with an untitled model holding the root object")
        void startsWithEmptyModel() {
            ModelDocumentStore store = new ModelDocumentStore(jsonMapper);

            assertEquals(ModelDocumentStore.UNTITLED, store.documentName());
            assertFalse(store.isDirty());
            assertThat(store.allObjects()).extracting(ModelNodes::name).containsExactly(ModelKeys.ROOT_OBJECT_NAME);
        }

        @Test
        @DisplayName("rejects documents without a namespace list")
        void rejectsDocumentWithoutNamespaces() {
            ModelDocumentStore store = new ModelDocumentStore(jsonMapper);
            ObjectNode document = jsonMapper.createObjectNode().put("name", "x");

            assertThrows(IllegalArgumentException.class, () -> store.open(document, "bad.json"));
        }

        @Test
        @DisplayName("lists objects of every namespace in tree order")
        void listsObjectsInTreeOrder() {
            BridgeFixture fixture = BridgeFixture.withTestModel();

            assertThat(fixture.store.allObjects()).extracting(ModelNodes::name)
                    .containsExactly("Pac", "Role", "Customer", "Order");
        }
    }

    @Nested
    @DisplayName("atomic changes")
    class AtomicChanges {

        @Test
        @DisplayName("marks the document dirty after a successful change")
        void successfulChangeMarksDirty() {
            ModelDocumentStore store = new ModelDocumentStore(jsonMapper);
            ObjectNode namespace = store.namespaces().get(0);

            store.applyAtomically("add object", () -> store.insert(store.ensureList(namespace, ModelKeys.OBJECT),
                    jsonMapper.createObjectNode().put(ModelKeys.NAME, "Invoice")));

            assertTrue(store.isDirty());
            assertThat(store.allObjects()).extracting(ModelNodes::name).contains("Invoice");
        }

        @Test
        @DisplayName("restores the previous tree and keeps it clean when the change fails part way")
        void failedChangeRestoresTree() {
            ModelDocumentStore store = new ModelDocumentStore(jsonMapper);
            ObjectNode before = store.root().deepCopy();
            ObjectNode namespace = store.namespaces().get(0);

            assertThrows(IllegalStateException.class, () -> store.applyAtomically("add two objects", () -> {
                ArrayNode objects = store.ensureList(namespace, ModelKeys.OBJECT);
                store.insert(objects, jsonMapper.createObjectNode().put(ModelKeys.NAME, "Invoice"));
                throw new IllegalStateException("second insert failed");
            }));

            assertEquals(before, store.root());
            assertFalse(store.isDirty());
        }

        @Test
        @DisplayName("markSaved clears the dirty flag")
        void markSavedClearsDirty() {
            ModelDocumentStore store = new ModelDocumentStore(jsonMapper);
            store.applyAtomically("touch", () -> store.ensureList(store.namespaces().get(0), ModelKeys.USER_STORY));

            store.markSaved();

            assertFalse(store.isDirty());
        }
    }

    @Nested
    @DisplayName("lists")
    class Lists {

        @Test
        @DisplayName("ensureList creates a missing list once and then returns it")
        void ensureListCreatesOnce() {
            ModelDocumentStore store = new ModelDocumentStore(jsonMapper);
            ObjectNode pac = store.allObjects().get(0);

            ArrayNode created = store.ensureList(pac, ModelKeys.OBJECT_WORKFLOW);
            ArrayNode again = store.ensureList(pac, ModelKeys.OBJECT_WORKFLOW);

            assertSame(created, again);
            assertTrue(pac.get(ModelKeys.OBJECT_WORKFLOW).isArray());
        }

        @Test
        @DisplayName("children of a missing list is empty and creates nothing")
        void childrenOfMissingListIsEmpty() {
            ModelDocumentStore store = new ModelDocumentStore(jsonMapper);
            ObjectNode pac = store.allObjects().get(0);

            assertThat(store.children(pac, ModelKeys.REPORT)).isEmpty();
            assertFalse(pac.has(ModelKeys.REPORT));
        }

        @Test
        @DisplayName("update skips protected fields")
        void updateSkipsProtectedFields() {
            ModelDocumentStore store = new ModelDocumentStore(jsonMapper);
            ObjectNode entity = jsonMapper.createObjectNode().put(ModelKeys.NAME, "FirstName");
            ObjectNode fields = jsonMapper.createObjectNode().put(ModelKeys.NAME, "Renamed").put("labelText", "First");

            store.update(entity, fields, ModelKeys.NAME);

            assertEquals("FirstName", ModelNodes.name(entity));
            assertEquals("First", ModelNodes.text(entity, "labelText"));
        }
    }
}
