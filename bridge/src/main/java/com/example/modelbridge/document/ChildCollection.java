package com.example.modelbridge.document;

import java.util.Set;

/**
 * Order-significant child lists of the model, each identified by its owner kind and list key.
 * {@link #workflowKind()} is {@code null} for lists owned directly by a data object.
 */
public enum ChildCollection {

    OBJECT_PROP(null, ModelKeys.PROP, ModelKeys.NAME, "property", Set.of()),
    LOOKUP_ITEM(null, ModelKeys.LOOKUP_ITEM, ModelKeys.NAME, "lookup value", Set.of()),

    FORM_PARAM(WorkflowKind.FORM, ModelKeys.WORKFLOW_PARAM, ModelKeys.NAME, "param", Set.of()),
    FORM_BUTTON(WorkflowKind.FORM, ModelKeys.WORKFLOW_BUTTON, ModelKeys.BUTTON_NAME, "button", Set.of()),
    FORM_OUTPUT_VAR(WorkflowKind.FORM, ModelKeys.WORKFLOW_OUTPUT_VAR, ModelKeys.NAME, "output_var", Set.of()),

    REPORT_PARAM(WorkflowKind.REPORT, ModelKeys.REPORT_PARAM, ModelKeys.NAME, "param", Set.of()),
    REPORT_COLUMN(WorkflowKind.REPORT, ModelKeys.REPORT_COLUMN, ModelKeys.NAME, "column", Set.of()),
    REPORT_BUTTON(WorkflowKind.REPORT, ModelKeys.REPORT_BUTTON, ModelKeys.BUTTON_NAME, "button", Set.of()),

    GENERAL_FLOW_PARAM(WorkflowKind.GENERAL_FLOW, ModelKeys.WORKFLOW_PARAM, ModelKeys.NAME, "param", Set.of()),
    GENERAL_FLOW_OUTPUT_VAR(WorkflowKind.GENERAL_FLOW, ModelKeys.WORKFLOW_OUTPUT_VAR, ModelKeys.NAME, "output_var", Set.of()),

    PAGE_INIT_FLOW_OUTPUT_VAR(WorkflowKind.PAGE_INIT_FLOW, ModelKeys.WORKFLOW_OUTPUT_VAR, ModelKeys.NAME, "output_var",
            Set.of("defaultValue", ModelKeys.FK_OBJECT_NAME_ALT, ModelKeys.FK_OBJECT_NAME, ModelKeys.IS_FK, "isFKLookup"));

    private final WorkflowKind workflowKind;
    private final String listKey;
    private final String nameField;
    private final String argumentName;
    private final Set<String> unsupportedFields;

    ChildCollection(WorkflowKind workflowKind, String listKey, String nameField, String argumentName,
                    Set<String> unsupportedFields) {
        this.workflowKind = workflowKind;
        this.listKey = listKey;
        this.nameField = nameField;
        this.argumentName = argumentName;
        this.unsupportedFields = unsupportedFields;
    }

    public WorkflowKind workflowKind() {
        return workflowKind;
    }

    public boolean isObjectLevel() {
        return workflowKind == null;
    }

    public String listKey() {
        return listKey;
    }

    /** Field holding the element's name ({@code buttonName} for buttons). */
    public String nameField() {
        return nameField;
    }

    /** Argument name used by commands for one element of this list, e.g. {@code output_var}. */
    public String argumentName() {
        return argumentName;
    }

    public String label() {
        return argumentName.replace('_', ' ');
    }

    /** Attributes elements of this list must not carry. */
    public Set<String> unsupportedFields() {
        return unsupportedFields;
    }
}
