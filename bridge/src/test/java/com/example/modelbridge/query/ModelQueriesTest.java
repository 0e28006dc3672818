package com.example.modelbridge.query;

import com.example.modelbridge.BridgeFixture;
import com.example.modelbridge.document.WorkflowKind;
import com.example.modelbridge.resolve.Resolution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ModelQueries")
class ModelQueriesTest {

    private final BridgeFixture fixture = BridgeFixture.withTestModel();
    private final ModelQueries queries = fixture.queries;

    private static List<String> values(JsonNode list, String field) {
        List<String> values = new ArrayList<>();
        list.forEach(element -> values.add(element.get(field).asString()));
        return values;
    }

    private JsonNode summaryOf(String name) {
        for (JsonNode entry : queries.usageSummary()) {
            if (entry.get("dataObjectName").asString().equals(name)) {
                return entry;
            }
        }
        throw new AssertionError("no usage summary for " + name);
    }

    @Test
    @DisplayName("reads are idempotent and return copies")
    void readsDoNotMutate() {
        ArrayNode first = queries.objects();
        ((ObjectNode) first.get(0)).put("name", "Changed");

        assertEquals(queries.objects(), queries.objects());
        assertEquals("Pac", queries.objects().get(0).get("name").asString());
        assertFalse(fixture.store.isDirty());
    }

    @Nested
    @DisplayName("data objects")
    class DataObjects {

        @Test
        @DisplayName("summaries follow tree order")
        void summaries() {
            assertThat(values(queries.dataObjectSummaries(null, null, null), "name"))
                    .containsExactly("Pac", "Role", "Customer", "Order");
        }

        @Test
        @DisplayName("filters combine: search text, lookup flag and parent")
        void filters() {
            assertThat(values(queries.dataObjectSummaries("cust", null, null), "name")).containsExactly("Customer");
            assertThat(values(queries.dataObjectSummaries(null, "true", null), "name")).containsExactly("Role");
            assertThat(values(queries.dataObjectSummaries(null, "false", "customer"), "name")).containsExactly("Order");
            assertEquals(0, queries.dataObjectSummaries("order", "true", null).size());
        }

        @Test
        @DisplayName("property counts are reported")
        void propCount() {
            JsonNode customer = queries.dataObjectSummaries("Customer", null, null).get(0);

            assertEquals(4, customer.get("propCount").asInt());
        }

        @Test
        @DisplayName("a single object is found loosely")
        void singleObject() {
            assertTrue(queries.dataObject(" order ").isPresent());
            assertTrue(queries.dataObject("Invoice").isEmpty());
        }
    }

    @Nested
    @DisplayName("usage")
    class Usage {

        @Test
        @DisplayName("counts every kind of reference to Customer")
        void customerSummary() {
            JsonNode customer = summaryOf("Customer");

            assertEquals(11, customer.get("totalReferences").asInt());
            assertEquals(2, customer.get("formReferences").asInt());
            assertEquals(3, customer.get("reportReferences").asInt());
            assertEquals(4, customer.get("flowReferences").asInt());
            assertEquals(1, customer.get("propertyReferences").asInt());
            assertEquals(1, customer.get("childObjectReferences").asInt());
        }

        @Test
        @DisplayName("the root object is referenced by foreign keys and children")
        void rootUsage() {
            JsonNode pac = queries.usage("Pac").orElseThrow();

            assertEquals(3, pac.get("totalReferences").asInt());
            assertThat(values(pac.get("references"), "referenceType"))
                    .containsExactlyInAnyOrder("Foreign Key Target", "Parent Object", "Parent Object");
        }

        @Test
        @DisplayName("report columns name their source object")
        void reportColumnSource() {
            JsonNode usage = queries.usage("Customer").orElseThrow();

            assertThat(values(usage.get("references"), "referencedBy"))
                    .contains("CustomerListReport.FirstName", "CustomerListReport.LastName", "Order.CustomerID");
        }

        @Test
        @DisplayName("unknown objects have no usage")
        void unknown() {
            assertTrue(queries.usage("Ghost").isEmpty());
        }
    }

    @Nested
    @DisplayName("workflows")
    class Workflows {

        @Test
        @DisplayName("forms are listed with their owner")
        void forms() {
            ArrayNode forms = queries.workflows(WorkflowKind.FORM, null, null);

            assertThat(values(forms, "name")).containsExactly("CustomerAddForm", "DetailsForm", "DetailsForm");
            assertThat(values(forms, ModelQueries.OWNER_FIELD)).containsExactly("Customer", "Customer", "Order");
        }

        @Test
        @DisplayName("a shared name returns every owner's match unless an owner is given")
        void nameFilter() {
            assertEquals(2, queries.workflows(WorkflowKind.FORM, "detailsform", null).size());
            assertThat(values(queries.workflows(WorkflowKind.FORM, "DetailsForm", "Order"), "titleText"))
                    .containsExactly("Order Details");
        }

        @Test
        @DisplayName("general flows exclude page init and dyna flows")
        void generalFlows() {
            assertThat(values(queries.workflows(WorkflowKind.GENERAL_FLOW, null, null), "name"))
                    .containsExactly("NotifyCustomer");
            assertThat(values(queries.workflows(WorkflowKind.PAGE_INIT_FLOW, null, null), "name"))
                    .containsExactly("CustomerAddFormInitObjWF", "CustomerListReportInitReport");
        }

        @Test
        @DisplayName("reports come from the report list")
        void reports() {
            assertThat(values(queries.workflows(WorkflowKind.REPORT, null, "customer"), "name"))
                    .containsExactly("CustomerListReport");
            assertEquals(0, queries.workflows(WorkflowKind.REPORT, null, "Ghost").size());
        }
    }

    @Nested
    @DisplayName("lookups, roles and stories")
    class Lookups {

        @Test
        @DisplayName("lookup values of one object or of all lookup objects")
        void lookupValues() {
            assertThat(values(queries.lookupValues("Role").orElseThrow(), "name")).containsExactly("Unknown", "User", "Admin");
            assertThat(values(queries.lookupValues(null).orElseThrow(), ModelQueries.OWNER_FIELD))
                    .containsOnly("Role");
            assertTrue(queries.lookupValues("Ghost").isEmpty());
        }

        @Test
        @DisplayName("roles are sorted by name")
        void roles() {
            assertThat(values(queries.roles(), "name")).containsExactly("Admin", "Unknown", "User");
        }

        @Test
        @DisplayName("roles are empty without a Role object")
        void noRoles() {
            assertEquals(0, BridgeFixture.withEmptyModel().queries.roles().size());
        }

        @Test
        @DisplayName("user stories are listed")
        void stories() {
            assertThat(values(queries.userStories(), "storyNumber")).containsExactly("1");
        }
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("an ambiguous name reports every candidate")
        void ambiguous() {
            ObjectNode description = queries.describe(queries.resolve("form", "DetailsForm", null));

            assertTrue(description.get("ambiguous").asBoolean());
            assertEquals("Customer", description.get("ownerObjectName").asString());
            assertEquals(2, description.get("candidates").size());
            assertThat(description.get("candidates").toString()).contains("Customer", "Order");
        }

        @Test
        @DisplayName("an owner hint narrows the match")
        void ownerHint() {
            ObjectNode description = queries.describe(queries.resolve("form", "DetailsForm", "Order"));

            assertFalse(description.get("ambiguous").asBoolean());
            assertEquals("Order", description.get("ownerObjectName").asString());
        }

        @Test
        @DisplayName("data objects resolve exactly")
        void dataObject() {
            Resolution exact = queries.resolve("data_object", "Customer", null);
            Resolution wrongCase = queries.resolve("data_object", "customer", null);

            assertTrue(exact.isFound());
            assertFalse(wrongCase.isFound());
        }

        @Test
        @DisplayName("unknown kinds are rejected")
        void unknownKind() {
            assertThrows(IllegalArgumentException.class, () -> queries.resolve("widget", "X", null));
        }
    }
}
