package com.example.modelbridge.document;

import tools.jackson.databind.node.ObjectNode;

import java.util.Locale;

/**
 * Kinds of workflow-like entities owned by a data object.
 * <p>
 * Forms, general flows, page init flows and DynaFlow workflows share the {@code objectWorkflow}
 * list and are told apart by naming suffix and flags; reports live in their own {@code report} list.
 * </p>
 */
public enum WorkflowKind {

    FORM("form", ModelKeys.OBJECT_WORKFLOW),
    REPORT("report", ModelKeys.REPORT),
    GENERAL_FLOW("general flow", ModelKeys.OBJECT_WORKFLOW),
    PAGE_INIT_FLOW("page init flow", ModelKeys.OBJECT_WORKFLOW),
    DYNA_FLOW("DynaFlow workflow", ModelKeys.OBJECT_WORKFLOW);

    public static final String FORM_INIT_SUFFIX = "InitObjWF";
    public static final String REPORT_INIT_SUFFIX = "InitReport";

    private final String label;
    private final String listKey;

    WorkflowKind(String label, String listKey) {
        this.label = label;
        this.listKey = listKey;
    }

    public String label() {
        return label;
    }

    /** Key of the data object list holding entities of this kind. */
    public String listKey() {
        return listKey;
    }

    public boolean matches(ObjectNode workflow) {
        if (this == REPORT) {
            return true;
        }
        return classify(workflow) == this;
    }

    /**
     * Classifies an {@code objectWorkflow} element. A workflow without an {@code isPage} flag
     * is treated as a general flow.
     */
    public static WorkflowKind classify(ObjectNode workflow) {
        if (isPageInitName(ModelNodes.name(workflow))) {
            return PAGE_INIT_FLOW;
        }
        if (ModelNodes.isTrue(workflow, ModelKeys.IS_DYNA_FLOW) || ModelNodes.isTrue(workflow, ModelKeys.IS_DYNA_FLOW_TASK)) {
            return DYNA_FLOW;
        }
        if (ModelNodes.isTrue(workflow, ModelKeys.IS_PAGE)) {
            return FORM;
        }
        return GENERAL_FLOW;
    }

    public static boolean isPageInitName(String name) {
        if (name == null) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(FORM_INIT_SUFFIX.toLowerCase(Locale.ROOT))
                || lower.endsWith(REPORT_INIT_SUFFIX.toLowerCase(Locale.ROOT));
    }
}
