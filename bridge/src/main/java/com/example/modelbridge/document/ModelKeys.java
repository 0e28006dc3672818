package com.example.modelbridge.document;

/**
 * Property names used by the model document tree.
 */
public final class ModelKeys {

    public static final String NAMESPACE = "namespace";
    public static final String OBJECT = "object";
    public static final String USER_STORY = "userStory";

    public static final String NAME = "name";
    public static final String BUTTON_NAME = "buttonName";
    public static final String PARENT_OBJECT_NAME = "parentObjectName";
    public static final String IS_LOOKUP = "isLookup";
    public static final String CODE_DESCRIPTION = "codeDescription";
    public static final String TITLE_TEXT = "titleText";
    public static final String IS_PAGE = "isPage";
    public static final String IS_DYNA_FLOW = "isDynaFlow";
    public static final String IS_DYNA_FLOW_TASK = "isDynaFlowTask";
    public static final String ROLE_REQUIRED = "roleRequired";
    public static final String TARGET_CHILD_OBJECT = "targetChildObject";
    public static final String INIT_OBJECT_WORKFLOW_NAME = "initObjectWorkflowName";

    public static final String PROP = "prop";
    public static final String LOOKUP_ITEM = "lookupItem";
    public static final String OBJECT_WORKFLOW = "objectWorkflow";
    public static final String REPORT = "report";
    public static final String PROP_SUBSCRIPTION = "propSubscription";
    public static final String MODEL_PKG = "modelPkg";

    public static final String WORKFLOW_PARAM = "objectWorkflowParam";
    public static final String WORKFLOW_BUTTON = "objectWorkflowButton";
    public static final String WORKFLOW_OUTPUT_VAR = "objectWorkflowOutputVar";
    public static final String REPORT_PARAM = "reportParam";
    public static final String REPORT_COLUMN = "reportColumn";
    public static final String REPORT_BUTTON = "reportButton";

    public static final String IS_FK = "isFK";
    public static final String FK_OBJECT_NAME = "fkObjectName";
    /** Spelling used by workflow parameters and output variables. */
    public static final String FK_OBJECT_NAME_ALT = "fKObjectName";
    public static final String DATA_TYPE = "sqlServerDBDataType";
    public static final String VISUALIZATION_TYPE = "visualizationType";

    public static final String TRUE = "true";
    public static final String FALSE = "false";

    /** Name of the root object every model carries; lookup objects hang off it. */
    public static final String ROOT_OBJECT_NAME = "Pac";
    public static final String ROLE_OBJECT_NAME = "Role";

    private ModelKeys() {
    }
}
