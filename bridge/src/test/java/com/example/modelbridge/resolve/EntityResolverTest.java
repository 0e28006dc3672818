package com.example.modelbridge.resolve;

import com.example.modelbridge.BridgeFixture;
import com.example.modelbridge.api.AmbiguousEntityException;
import com.example.modelbridge.api.EntityNotFoundException;
import com.example.modelbridge.document.ChildCollection;
import com.example.modelbridge.document.ModelKeys;
import com.example.modelbridge.document.ModelNodes;
import com.example.modelbridge.document.WorkflowKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("EntityResolver")
class EntityResolverTest {

    private final BridgeFixture fixture = BridgeFixture.withTestModel();
    private final EntityResolver resolver = fixture.resolver;

    @Nested
    @DisplayName("data objects")
    class DataObjects {

        @Test
        @DisplayName("match by exact, case-sensitive name")
        void exactMatchOnly() {
            Resolution found = resolver.resolveObject("Customer");
            Resolution wrongCase = resolver.resolveObject("customer");

            assertTrue(found.isFound());
            assertEquals(2, found.entity().index());
            assertFalse(wrongCase.isFound());
        }

        @Test
        @DisplayName("loose lookup ignores case and whitespace")
        void looseLookup() {
            assertThat(resolver.findObject("customer")).map(ModelNodes::name).contains("Customer");
            assertThat(resolver.findObject(" Cus tomer ")).map(ModelNodes::name).contains("Customer");
            assertThat(resolver.findObject("Nobody")).isEmpty();
        }

        @Test
        @DisplayName("not found carries the searched name instead of throwing")
        void notFoundIsAnOutcome() {
            Resolution missing = resolver.resolveObject("DoesNotExist");

            assertFalse(missing.isFound());
            assertEquals("DoesNotExist", missing.name());
            assertEquals(EntityResolver.DATA_OBJECT, missing.kind());
            EntityNotFoundException ex = assertThrows(EntityNotFoundException.class, missing::orElseThrow);
            assertEquals("DoesNotExist", ex.getName());
        }

        @Test
        @DisplayName("a namespace whose object list is null holds no objects")
        void nullObjectList() {
            fixture.store.namespaces().get(0).putNull(ModelKeys.OBJECT);

            assertFalse(resolver.resolveObject("Customer").isFound());
            assertFalse(resolver.objectExists("Customer"));
        }
    }

    @Nested
    @DisplayName("workflows")
    class Workflows {

        @Test
        @DisplayName("match case-insensitively and report the owner")
        void caseInsensitiveMatch() {
            ResolvedEntity form = resolver.resolveWorkflow(WorkflowKind.FORM, "customeraddform", null).orElseThrow();

            assertEquals("CustomerAddForm", ModelNodes.name(form.node()));
            assertEquals("Customer", form.ownerObjectName());
            assertFalse(form.isAmbiguous());
        }

        @Test
        @DisplayName("only match entities of the requested kind")
        void kindIsRespected() {
            assertFalse(resolver.resolveWorkflow(WorkflowKind.FORM, "CustomerAddFormInitObjWF", null).isFound());
            assertTrue(resolver.resolveWorkflow(WorkflowKind.PAGE_INIT_FLOW, "CustomerAddFormInitObjWF", null).isFound());
            assertFalse(resolver.resolveWorkflow(WorkflowKind.GENERAL_FLOW, "CustomerSync", null).isFound());
            assertTrue(resolver.resolveWorkflow(WorkflowKind.REPORT, "CustomerListReport", null).isFound());
        }

        @Test
        @DisplayName("without owner hint, a name held by several owners resolves to the first and is flagged")
        void ambiguousWithoutHint() {
            Resolution resolution = resolver.resolveWorkflow(WorkflowKind.FORM, "DetailsForm", null);

            ResolvedEntity first = resolution.orElseThrow();
            assertEquals("Customer", first.ownerObjectName());
            assertTrue(first.isAmbiguous());
            assertThat(first.candidates()).containsExactly("Customer", "Order");
            AmbiguousEntityException ex = assertThrows(AmbiguousEntityException.class, resolution::requireUnambiguous);
            assertThat(ex.getCandidates()).containsExactly("Customer", "Order");
        }

        @Test
        @DisplayName("an owner hint scopes the search to that owner")
        void ownerHintScopes() {
            ResolvedEntity form = resolver.resolveWorkflow(WorkflowKind.FORM, "DetailsForm", "Order").requireUnambiguous();

            assertEquals("Order", form.ownerObjectName());
            assertFalse(resolver.resolveWorkflow(WorkflowKind.FORM, "CustomerAddForm", "Order").isFound());
        }

        @Test
        @DisplayName("an unknown owner hint yields not found scoped to that owner")
        void unknownOwnerHint() {
            Resolution resolution = resolver.resolveWorkflow(WorkflowKind.FORM, "DetailsForm", "Nobody");

            assertFalse(resolution.isFound());
            assertThat(resolution.scope()).contains("Nobody");
        }

        @Test
        @DisplayName("workflow names are checked across all owners and kinds")
        void workflowNameExists() {
            assertTrue(resolver.workflowNameExists("customerlistreport"));
            assertTrue(resolver.workflowNameExists("NOTIFYCUSTOMER"));
            assertFalse(resolver.workflowNameExists("InvoiceForm"));
        }
    }

    @Nested
    @DisplayName("child elements")
    class Children {

        @Test
        @DisplayName("resolve inside the container with position and owning chain")
        void resolveChild() {
            ResolvedEntity form = resolver.resolveWorkflow(WorkflowKind.FORM, "CustomerAddForm", null).orElseThrow();

            ResolvedEntity param = resolver.resolveChild(ChildCollection.FORM_PARAM, form, "email").orElseThrow();

            assertEquals("Email", ModelNodes.name(param.node()));
            assertEquals(2, param.index());
            assertEquals("Customer", param.ownerObjectName());
            assertEquals("CustomerAddForm", ModelNodes.name(param.ownerWorkflow()));
        }

        @Test
        @DisplayName("buttons resolve by buttonName")
        void buttonsByButtonName() {
            ResolvedEntity form = resolver.resolveWorkflow(WorkflowKind.FORM, "CustomerAddForm", null).orElseThrow();

            assertEquals(1, resolver.resolveChild(ChildCollection.FORM_BUTTON, form, "cancel").orElseThrow().index());
        }

        @Test
        @DisplayName("properties of a data object have no owning workflow")
        void objectLevelChildren() {
            ResolvedEntity customer = resolver.resolveObject("Customer").orElseThrow();

            ResolvedEntity prop = resolver.resolveChild(ChildCollection.OBJECT_PROP, customer, "LastName").orElseThrow();

            assertEquals(2, prop.index());
            assertNull(prop.ownerWorkflow());
        }

        @Test
        @DisplayName("a missing child reports its container as scope")
        void missingChild() {
            ResolvedEntity customer = resolver.resolveObject("Customer").orElseThrow();

            Resolution missing = resolver.resolveChild(ChildCollection.OBJECT_PROP, customer, "Phone");

            assertFalse(missing.isFound());
            assertThat(missing.scope()).contains("Customer");
        }
    }
}
