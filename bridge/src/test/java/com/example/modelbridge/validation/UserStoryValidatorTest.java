package com.example.modelbridge.validation;

import com.example.modelbridge.BridgeFixture;
import com.example.modelbridge.document.ModelKeys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.node.ArrayNode;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("UserStoryValidator")
class UserStoryValidatorTest {

    private final BridgeFixture fixture = BridgeFixture.withTestModel();
    private final UserStoryValidator validator = new UserStoryValidator(fixture.store);
    private final List<ValidationError> errors = new ArrayList<>();

    private String check(String text) {
        validator.checkStoryText(text, "storyText", errors);
        return errors.isEmpty() ? null : errors.get(0).message();
    }

    @Nested
    @DisplayName("role extraction")
    class RoleExtraction {

        @Test
        @DisplayName("reads both phrasings, with or without brackets")
        void phrasings() {
            assertThat(UserStoryValidator.extractRole("A Sales Manager wants to view all orders")).contains("Sales Manager");
            assertThat(UserStoryValidator.extractRole("As a [Clerk], I want to add a customer")).contains("Clerk");
            assertThat(UserStoryValidator.extractRole("  as a   clerk I want to add a customer")).contains("clerk");
        }

        @Test
        @DisplayName("other sentences carry no role")
        void noRole() {
            assertThat(UserStoryValidator.extractRole("Customers can be exported")).isEmpty();
            assertThat(UserStoryValidator.extractRole("An Admin wants to add a customer")).isEmpty();
            assertThat(UserStoryValidator.extractRole(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("data object extraction")
    class DataObjectExtraction {

        @Test
        @DisplayName("view all X in Y names both, except the application itself")
        void viewAll() {
            assertThat(UserStoryValidator.extractDataObjects("A User wants to view all the orders in a customer for review"))
                    .containsExactly("orders", "customer");
            assertThat(UserStoryValidator.extractDataObjects("A User wants to view all orders in the application"))
                    .containsExactly("orders");
        }

        @Test
        @DisplayName("action verbs name the following noun up to a boundary word")
        void actions() {
            assertThat(UserStoryValidator.extractDataObjects("A User wants to add an order line to the cart"))
                    .containsExactly("order line");
            assertThat(UserStoryValidator.extractDataObjects("A User wants to update a customer and delete an order."))
                    .containsExactly("customer", "order");
            assertThat(UserStoryValidator.extractDataObjects("A User wants to log in")).isEmpty();
        }

        @Test
        @DisplayName("multi-word names compare in PascalCase")
        void pascalCase() {
            assertEquals("OrderLine", UserStoryValidator.toPascalCase("order line"));
        }
    }

    @Test
    @DisplayName("a story with a known role and existing objects passes")
    void validStory() {
        assertEquals(null, check("A User wants to view all orders in the customer"));
    }

    @Test
    @DisplayName("roles match the display name too")
    void displayNameRole() {
        assertEquals(null, check("As a Administrator, I want to delete a customer"));
    }

    @Test
    @DisplayName("unknown roles and objects are reported one at a time")
    void failures() {
        assertEquals("Unable to extract role from user story text", check("Orders can be deleted"));
        errors.clear();
        assertEquals("Role \"Pilot\" does not exist in model", check("A Pilot wants to add an order"));
        errors.clear();
        assertEquals("Data object(s) \"invoice, shipment\" do not exist in model",
                check("A User wants to add an invoice and remove a shipment"));
        assertEquals(1, errors.size());
        assertEquals("storyText", errors.get(0).field());
    }

    @Test
    @DisplayName("without a Role object any role is accepted")
    void noRoleObject() {
        ((ArrayNode) fixture.store.namespaces().get(0).get(ModelKeys.OBJECT)).remove(1);

        assertEquals(null, check("A Pilot wants to add an order"));
        assertTrue(errors.isEmpty());
    }
}
