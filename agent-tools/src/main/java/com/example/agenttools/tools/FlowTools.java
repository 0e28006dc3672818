package com.example.agenttools.tools;

import com.example.agenttools.client.BridgeClient;
import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Tools for general flows, page init flows and DynaFlow workflows.
 * Page init flows are created together with their form or report and cannot be created here;
 * DynaFlow workflows are only read.
 */
public class FlowTools extends BridgeTools {

    private static final String GENERAL_FLOW = "general_flow_name";
    private static final String PAGE_INIT_FLOW = "page_init_flow_name";
    private static final String WORKFLOW = "workflow_name";
    private static final String OWNER_HINT = "Data object owning the flow; needed when several objects have a flow of this name";

    public FlowTools(BridgeClient client, JsonMapper jsonMapper) {
        super(client, jsonMapper);
    }

    @Tool(name = "list_general_flows", value = "List general (non-page) flows, each with its owning data object")
    public String listGeneralFlows(@P(value = "Exact flow name (case-insensitive)", required = false) String generalFlowName,
                                   @P(value = "Only flows owned by this data object", required = false) String ownerObjectName) {
        return list("/api/general-flows", filters(GENERAL_FLOW, generalFlowName, "owner_object_name", ownerObjectName),
                "generalFlows", "General flows loaded from the model via the data channel");
    }

    @Tool(name = "get_general_flow", value = "Get one general flow with its parameters and output variables")
    public String getGeneralFlow(@P("Name of the general flow") String generalFlowName,
                                 @P(value = OWNER_HINT, required = false) String ownerObjectName) {
        return single("/api/general-flows", filters(GENERAL_FLOW, generalFlowName, "owner_object_name", ownerObjectName),
                "generalFlow", "General flow", generalFlowName);
    }

    @Tool(name = "create_general_flow", value = "Create a general flow on a data object. The name must not end with "
            + "InitObjWF or InitReport.")
    public String createGeneralFlow(@P("Data object that owns the flow") String ownerObjectName,
                                    @P("PascalCase flow name, unique in the model") String generalFlowName,
                                    @P(value = "Description of the flow", required = false) String codeDescription) {
        ObjectNode args = args();
        putIfPresent(args, "owner_object_name", ownerObjectName);
        putIfPresent(args, GENERAL_FLOW, generalFlowName);
        putIfPresent(args, "codeDescription", codeDescription);
        return command("create_general_flow", args);
    }

    @Tool(name = "update_general_flow", value = "Merge attributes such as codeDescription into a general flow")
    public String updateGeneralFlow(@P("Name of the general flow") String generalFlowName,
                                    @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                    @P("Attributes to set") Map<String, Object> updates) {
        ObjectNode args = workflowArgs(GENERAL_FLOW, generalFlowName, ownerObjectName);
        args.set("updates", toNode(updates));
        return command("update_general_flow", args);
    }

    @Tool(name = "add_general_flow_param", value = "Append an input parameter to a general flow")
    public String addGeneralFlowParam(@P("Name of the general flow") String generalFlowName,
                                      @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                      @P("The parameter: PascalCase name plus attributes") Map<String, Object> param) {
        return addChild("add_general_flow_param", GENERAL_FLOW, generalFlowName, ownerObjectName, "param", param);
    }

    @Tool(name = "update_general_flow_param", value = "Merge attributes into a general flow parameter")
    public String updateGeneralFlowParam(@P("Name of the general flow") String generalFlowName,
                                         @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                         @P("Name of the parameter") String paramName,
                                         @P("Attributes to set") Map<String, Object> updates) {
        return updateChild("update_general_flow_param", GENERAL_FLOW, generalFlowName, ownerObjectName,
                "param_name", paramName, updates);
    }

    @Tool(name = "move_general_flow_param", value = "Move a general flow parameter to a new 0-based position")
    public String moveGeneralFlowParam(@P("Name of the general flow") String generalFlowName,
                                       @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                       @P("Name of the parameter") String paramName,
                                       @P("Target position, 0-based") Integer newPosition) {
        return moveChild("move_general_flow_param", GENERAL_FLOW, generalFlowName, ownerObjectName,
                "param_name", paramName, newPosition);
    }

    @Tool(name = "add_general_flow_output_var", value = "Append an output variable to a general flow")
    public String addGeneralFlowOutputVar(@P("Name of the general flow") String generalFlowName,
                                          @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                          @P("The output variable: PascalCase name plus attributes") Map<String, Object> outputVar) {
        return addChild("add_general_flow_output_var", GENERAL_FLOW, generalFlowName, ownerObjectName, "output_var", outputVar);
    }

    @Tool(name = "update_general_flow_output_var", value = "Merge attributes into a general flow output variable")
    public String updateGeneralFlowOutputVar(@P("Name of the general flow") String generalFlowName,
                                             @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                             @P("Name of the output variable") String outputVarName,
                                             @P("Attributes to set") Map<String, Object> updates) {
        return updateChild("update_general_flow_output_var", GENERAL_FLOW, generalFlowName, ownerObjectName,
                "output_var_name", outputVarName, updates);
    }

    @Tool(name = "move_general_flow_output_var", value = "Move a general flow output variable to a new 0-based position")
    public String moveGeneralFlowOutputVar(@P("Name of the general flow") String generalFlowName,
                                           @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                           @P("Name of the output variable") String outputVarName,
                                           @P("Target position, 0-based") Integer newPosition) {
        return moveChild("move_general_flow_output_var", GENERAL_FLOW, generalFlowName, ownerObjectName,
                "output_var_name", outputVarName, newPosition);
    }

    @Tool(name = "list_page_init_flows", value = "List page init flows (the <Form>InitObjWF and <Report>InitReport flows)")
    public String listPageInitFlows(@P(value = "Exact flow name (case-insensitive)", required = false) String pageInitFlowName,
                                    @P(value = "Only flows owned by this data object", required = false) String ownerObjectName) {
        return list("/api/page-init-flows", filters(PAGE_INIT_FLOW, pageInitFlowName, "owner_object_name", ownerObjectName),
                "pageInitFlows", "Page init flows loaded from the model via the data channel");
    }

    @Tool(name = "get_page_init_flow", value = "Get one page init flow with its output variables")
    public String getPageInitFlow(@P("Name of the page init flow") String pageInitFlowName,
                                  @P(value = OWNER_HINT, required = false) String ownerObjectName) {
        return single("/api/page-init-flows", filters(PAGE_INIT_FLOW, pageInitFlowName, "owner_object_name", ownerObjectName),
                "pageInitFlow", "Page init flow", pageInitFlowName);
    }

    @Tool(name = "update_page_init_flow", value = "Merge attributes into a page init flow")
    public String updatePageInitFlow(@P("Name of the page init flow") String pageInitFlowName,
                                     @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                     @P("Attributes to set") Map<String, Object> updates) {
        ObjectNode args = workflowArgs(PAGE_INIT_FLOW, pageInitFlowName, ownerObjectName);
        args.set("updates", toNode(updates));
        return command("update_page_init_flow", args);
    }

    @Tool(name = "add_page_init_flow_output_var", value = "Append an output variable to a page init flow. "
            + "defaultValue, fKObjectName, isFK and isFKLookup are not supported here.")
    public String addPageInitFlowOutputVar(@P("Name of the page init flow") String pageInitFlowName,
                                           @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                           @P("The output variable: PascalCase name plus attributes") Map<String, Object> outputVar) {
        return addChild("add_page_init_flow_output_var", PAGE_INIT_FLOW, pageInitFlowName, ownerObjectName,
                "output_var", outputVar);
    }

    @Tool(name = "update_page_init_flow_output_var", value = "Merge attributes into a page init flow output variable")
    public String updatePageInitFlowOutputVar(@P("Name of the page init flow") String pageInitFlowName,
                                              @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                              @P("Name of the output variable") String outputVarName,
                                              @P("Attributes to set") Map<String, Object> updates) {
        return updateChild("update_page_init_flow_output_var", PAGE_INIT_FLOW, pageInitFlowName, ownerObjectName,
                "output_var_name", outputVarName, updates);
    }

    @Tool(name = "move_page_init_flow_output_var", value = "Move a page init flow output variable to a new 0-based position")
    public String movePageInitFlowOutputVar(@P("Name of the page init flow") String pageInitFlowName,
                                            @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                            @P("Name of the output variable") String outputVarName,
                                            @P("Target position, 0-based") Integer newPosition) {
        return moveChild("move_page_init_flow_output_var", PAGE_INIT_FLOW, pageInitFlowName, ownerObjectName,
                "output_var_name", outputVarName, newPosition);
    }

    @Tool(name = "get_general_flow_schema", value = "Describe the attributes of a general flow")
    public String getGeneralFlowSchema() {
        return schema("general_flow");
    }

    @Tool(name = "get_page_init_flow_schema", value = "Describe the attributes of a page init flow")
    public String getPageInitFlowSchema() {
        return schema("page_init_flow");
    }

    @Tool(name = "list_workflows", value = "List DynaFlow workflows and tasks, each with its owning data object. Read-only.")
    public String listWorkflows(@P(value = "Exact workflow name (case-insensitive)", required = false) String workflowName,
                                @P(value = "Only workflows owned by this data object", required = false) String ownerObjectName) {
        return list("/api/workflows", filters(WORKFLOW, workflowName, "owner_object_name", ownerObjectName),
                "workflows", "DynaFlow workflows loaded from the model via the data channel");
    }

    @Tool(name = "get_workflow", value = "Get one DynaFlow workflow. Read-only.")
    public String getWorkflow(@P("Name of the workflow") String workflowName,
                              @P(value = OWNER_HINT, required = false) String ownerObjectName) {
        return single("/api/workflows", filters(WORKFLOW, workflowName, "owner_object_name", ownerObjectName),
                "workflow", "Workflow", workflowName);
    }

    @Tool(name = "get_workflow_schema", value = "Describe the attributes of a DynaFlow workflow")
    public String getWorkflowSchema() {
        return schema("workflow");
    }
}
