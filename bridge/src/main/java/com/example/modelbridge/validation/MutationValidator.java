package com.example.modelbridge.validation;

import com.example.modelbridge.document.ChildCollection;
import com.example.modelbridge.document.ModelDocumentStore;
import com.example.modelbridge.document.ModelKeys;
import com.example.modelbridge.document.ModelNodes;
import com.example.modelbridge.document.WorkflowKind;
import com.example.modelbridge.resolve.EntityResolver;
import lombok.RequiredArgsConstructor;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks proposed mutations against the model's naming, uniqueness, referential and enumeration rules.
 * <p>
 * Every check appends to a caller-supplied error list so that one pass reports all violations;
 * {@link #throwIfInvalid(List)} turns a non-empty list into a {@link MutationValidationException}.
 * </p>
 */
@RequiredArgsConstructor
public class MutationValidator {

    static final Pattern PASCAL_CASE = Pattern.compile("^[A-Z][A-Za-z0-9]*$");
    static final int MAX_TITLE_LENGTH = 100;

    public static final Set<String> VALID_DATA_TYPES = Set.of(
            "nvarchar", "varchar", "int", "bigint", "bit", "datetime", "date",
            "decimal", "float", "money", "uniqueidentifier", "text");
    public static final Set<String> VALID_VISUALIZATION_TYPES = Set.of(
            "Grid", "PieChart", "LineChart", "FlowChart", "CardView", "FolderView");
    private static final Set<String> VALID_FLAGS = Set.of(ModelKeys.TRUE, ModelKeys.FALSE);

    private final ModelDocumentStore store;
    private final EntityResolver resolver;

    public static void throwIfInvalid(List<ValidationError> errors) {
        if (!errors.isEmpty()) {
            throw new MutationValidationException(errors);
        }
    }

    /** Required, PascalCase. */
    public void checkName(String name, String field, List<ValidationError> errors) {
        if (ModelNodes.isBlank(name)) {
            errors.add(new ValidationError(field, field + " is required"));
        } else if (!PASCAL_CASE.matcher(name).matches()) {
            errors.add(new ValidationError(field, "'" + name
                    + "' must be PascalCase: start with an upper-case letter, letters and digits only, no spaces"));
        }
    }

    /** A new data object name: valid and not yet used by any object, compared case-insensitively. */
    public void checkNewObjectName(String name, String field, List<ValidationError> errors) {
        checkName(name, field, errors);
        if (ModelNodes.isBlank(name)) {
            return;
        }
        store.allObjects().stream()
                .map(ModelNodes::name)
                .filter(existing -> existing.equalsIgnoreCase(name))
                .findFirst()
                .ifPresent(existing -> errors.add(new ValidationError(field,
                        "a data object named '" + existing + "' already exists (names are compared case-insensitively)")));
    }

    /** A required reference that must exactly match an existing data object name. */
    public void checkParentObject(String parentObjectName, String field, List<ValidationError> errors) {
        if (ModelNodes.isBlank(parentObjectName)) {
            errors.add(new ValidationError(field, field + " is required"));
        } else if (!resolver.objectExists(parentObjectName)) {
            errors.add(new ValidationError(field, "parent data object '" + parentObjectName
                    + "' does not exist (names are case-sensitive)"));
        }
    }

    /** An optional reference: when given it must name an existing data object. */
    public void checkObjectReference(String objectName, String field, List<ValidationError> errors) {
        if (!ModelNodes.isBlank(objectName) && !resolver.objectExists(objectName)) {
            errors.add(new ValidationError(field, "data object '" + objectName + "' does not exist"));
        }
    }

    public void checkFlag(String value, String field, List<ValidationError> errors) {
        if (value != null && !VALID_FLAGS.contains(value)) {
            errors.add(new ValidationError(field, "must be \"true\" or \"false\", got '" + value + "'"));
        }
    }

    /** Lookup objects hang off the root object. */
    public void checkLookupParent(String isLookup, String parentObjectName, String field, List<ValidationError> errors) {
        if (ModelKeys.TRUE.equals(isLookup) && !ModelKeys.ROOT_OBJECT_NAME.equals(parentObjectName)) {
            errors.add(new ValidationError(field, "lookup objects must have parentObjectName '"
                    + ModelKeys.ROOT_OBJECT_NAME + "', got '" + parentObjectName + "'"));
        }
    }

    /**
     * A name for a new element of an ordered list: valid and unique among {@code siblings}
     * (case-insensitive). {@code self} is skipped so updates may keep their own name.
     */
    public void checkSiblingName(ChildCollection collection, List<ObjectNode> siblings, ObjectNode self,
                                 String name, String field, List<ValidationError> errors) {
        checkName(name, field, errors);
        if (ModelNodes.isBlank(name)) {
            return;
        }
        for (ObjectNode sibling : siblings) {
            if (sibling != self && ModelNodes.text(sibling, collection.nameField()).equalsIgnoreCase(name)) {
                errors.add(new ValidationError(field, "a " + collection.label() + " named '"
                        + ModelNodes.text(sibling, collection.nameField()) + "' already exists"));
                return;
            }
        }
    }

    /**
     * A new form, report or flow name: PascalCase, unique across every workflow in the model,
     * and carrying (page init flows) or not carrying (everything else) the page init suffix.
     */
    public void checkNewWorkflowName(WorkflowKind kind, String name, String field, List<ValidationError> errors) {
        checkName(name, field, errors);
        if (ModelNodes.isBlank(name)) {
            return;
        }
        boolean pageInitName = WorkflowKind.isPageInitName(name);
        if (kind == WorkflowKind.PAGE_INIT_FLOW && !pageInitName) {
            errors.add(new ValidationError(field, "page init flow names must end with '"
                    + WorkflowKind.FORM_INIT_SUFFIX + "' or '" + WorkflowKind.REPORT_INIT_SUFFIX + "'"));
        } else if (kind != WorkflowKind.PAGE_INIT_FLOW && pageInitName) {
            errors.add(new ValidationError(field, kind.label() + " names must not end with '"
                    + WorkflowKind.FORM_INIT_SUFFIX + "' or '" + WorkflowKind.REPORT_INIT_SUFFIX + "'"));
        }
        if (resolver.workflowNameExists(name)) {
            errors.add(new ValidationError(field, "a form, report or flow named '" + name
                    + "' already exists (names are compared case-insensitively)"));
        }
    }

    public void checkTitle(String title, String field, List<ValidationError> errors) {
        if (ModelNodes.isBlank(title)) {
            errors.add(new ValidationError(field, field + " is required"));
        } else if (title.length() > MAX_TITLE_LENGTH) {
            errors.add(new ValidationError(field, "must be at most " + MAX_TITLE_LENGTH + " characters"));
        }
    }

    /** When a {@code Role} object exists, {@code role} must be one of its lookup values. */
    public void checkRole(String role, String field, List<ValidationError> errors) {
        if (ModelNodes.isBlank(role)) {
            return;
        }
        Optional<ObjectNode> roleObject = resolver.findObject(ModelKeys.ROLE_OBJECT_NAME);
        if (roleObject.isEmpty()) {
            return;
        }
        boolean known = store.children(roleObject.get(), ModelKeys.LOOKUP_ITEM).stream()
                .anyMatch(item -> ModelNodes.name(item).equalsIgnoreCase(role));
        if (!known) {
            errors.add(new ValidationError(field, "role '" + role + "' is not a lookup value of "
                    + ModelKeys.ROLE_OBJECT_NAME));
        }
    }

    public void checkVisualizationType(String value, String field, List<ValidationError> errors) {
        if (value != null && !VALID_VISUALIZATION_TYPES.contains(value)) {
            errors.add(new ValidationError(field, "invalid visualizationType '" + value + "'; must be one of: "
                    + VALID_VISUALIZATION_TYPES));
        }
    }

    /**
     * Enumerated and referential checks over a new entity's attributes. Field names in errors are
     * prefixed with {@code prefix}.
     */
    public void checkAttributes(ObjectNode attributes, String prefix, List<ValidationError> errors) {
        checkEnumerations(attributes, prefix, errors);
        checkForeignKey(attributes, prefix, errors);
    }

    /**
     * Attribute values are strings; data types, {@code is*} flags and visualization types must be
     * among their allowed values.
     */
    public void checkEnumerations(ObjectNode attributes, String prefix, List<ValidationError> errors) {
        for (Map.Entry<String, JsonNode> attribute : attributes.properties()) {
            String key = attribute.getKey();
            JsonNode value = attribute.getValue();
            String field = prefix + "." + key;
            if (value.isObject() || value.isArray()) {
                continue;
            }
            if (!value.isString()) {
                errors.add(new ValidationError(field, "must be a string, got " + value));
            } else if (ModelKeys.DATA_TYPE.equals(key)) {
                if (!VALID_DATA_TYPES.contains(value.stringValue())) {
                    errors.add(new ValidationError(field, "invalid data type '" + value.stringValue()
                            + "'; must be one of: " + VALID_DATA_TYPES));
                }
            } else if (isFlagName(key)) {
                checkFlag(value.stringValue(), field, errors);
            } else if (ModelKeys.VISUALIZATION_TYPE.equals(key)) {
                checkVisualizationType(value.stringValue(), field, errors);
            }
        }
    }

    /**
     * {@code isFK == "true"} requires a foreign key target, and any given target must name an
     * existing data object.
     */
    public void checkForeignKey(ObjectNode attributes, String prefix, List<ValidationError> errors) {
        String fkField = attributes.has(ModelKeys.FK_OBJECT_NAME_ALT) ? ModelKeys.FK_OBJECT_NAME_ALT : ModelKeys.FK_OBJECT_NAME;
        String target = ModelNodes.text(attributes, fkField);
        if (ModelNodes.isTrue(attributes, ModelKeys.IS_FK) && ModelNodes.isBlank(target)) {
            errors.add(new ValidationError(prefix + "." + fkField, fkField + " is required when isFK is \"true\""));
        } else if (!ModelNodes.isBlank(target) && !resolver.objectExists(target)) {
            errors.add(new ValidationError(prefix + "." + fkField, "foreign key target '" + target
                    + "' does not exist"));
        }
    }

    public void checkUnsupportedFields(ChildCollection collection, ObjectNode item, String prefix,
                                       List<ValidationError> errors) {
        for (String field : collection.unsupportedFields()) {
            if (item.has(field)) {
                errors.add(new ValidationError(prefix + "." + field, "'" + field + "' is not supported on a "
                        + collection.workflowKind().label() + " " + collection.label()));
            }
        }
    }

    private static boolean isFlagName(String key) {
        return key.length() > 2 && key.startsWith("is") && Character.isUpperCase(key.charAt(2));
    }
}
