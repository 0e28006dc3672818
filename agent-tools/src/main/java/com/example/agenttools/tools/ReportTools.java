package com.example.agenttools.tools;

import com.example.agenttools.client.BridgeClient;
import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Tools for reports and their parameters, columns and buttons.
 */
public class ReportTools extends BridgeTools {

    private static final String REPORT = "report_name";
    private static final String OWNER_HINT = "Data object owning the report; needed when several objects have a report of this name";

    public ReportTools(BridgeClient client, JsonMapper jsonMapper) {
        super(client, jsonMapper);
    }

    @Tool(name = "list_reports", value = "List reports, each with its owning data object in _ownerObjectName")
    public String listReports(@P(value = "Exact report name (case-insensitive)", required = false) String reportName,
                              @P(value = "Only reports owned by this data object", required = false) String ownerObjectName) {
        return list("/api/reports", filters(REPORT, reportName, "owner_object_name", ownerObjectName),
                "reports", "Reports loaded from the model via the data channel");
    }

    @Tool(name = "get_report", value = "Get one report with its parameters, columns and buttons")
    public String getReport(@P("Name of the report") String reportName,
                            @P(value = OWNER_HINT, required = false) String ownerObjectName) {
        return single("/api/reports", filters(REPORT, reportName, "owner_object_name", ownerObjectName),
                "report", "Report", reportName);
    }

    @Tool(name = "create_report", value = "Create a report on a data object. Also creates its page init flow "
            + "(<report_name>InitReport) and a Back button.")
    public String createReport(@P("Data object that owns the report") String ownerObjectName,
                               @P("PascalCase report name, unique in the model") String reportName,
                               @P("Title shown on the report, at most 100 characters") String titleText,
                               @P(value = "Grid, PieChart, LineChart, FlowChart, CardView or FolderView; defaults to Grid",
                                       required = false) String visualizationType,
                               @P(value = "Role required to open the report", required = false) String roleRequired,
                               @P(value = "Data object the report targets", required = false) String targetChildObject) {
        ObjectNode args = args();
        putIfPresent(args, "owner_object_name", ownerObjectName);
        putIfPresent(args, REPORT, reportName);
        putIfPresent(args, "title_text", titleText);
        putIfPresent(args, "visualization_type", visualizationType);
        putIfPresent(args, "role_required", roleRequired);
        putIfPresent(args, "target_child_object", targetChildObject);
        return command("create_report", args);
    }

    @Tool(name = "update_report", value = "Merge attributes such as titleText or visualizationType into a report")
    public String updateReport(@P("Name of the report") String reportName,
                               @P(value = OWNER_HINT, required = false) String ownerObjectName,
                               @P("Attributes to set") Map<String, Object> updates) {
        ObjectNode args = workflowArgs(REPORT, reportName, ownerObjectName);
        args.set("updates", toNode(updates));
        return command("update_report", args);
    }

    @Tool(name = "add_report_param", value = "Append a filter parameter to a report")
    public String addReportParam(@P("Name of the report") String reportName,
                                 @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                 @P("The parameter: PascalCase name plus attributes") Map<String, Object> param) {
        return addChild("add_report_param", REPORT, reportName, ownerObjectName, "param", param);
    }

    @Tool(name = "update_report_param", value = "Merge attributes into a report parameter")
    public String updateReportParam(@P("Name of the report") String reportName,
                                    @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                    @P("Name of the parameter") String paramName,
                                    @P("Attributes to set") Map<String, Object> updates) {
        return updateChild("update_report_param", REPORT, reportName, ownerObjectName, "param_name", paramName, updates);
    }

    @Tool(name = "move_report_param", value = "Move a report parameter to a new 0-based position")
    public String moveReportParam(@P("Name of the report") String reportName,
                                  @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                  @P("Name of the parameter") String paramName,
                                  @P("Target position, 0-based") Integer newPosition) {
        return moveChild("move_report_param", REPORT, reportName, ownerObjectName, "param_name", paramName, newPosition);
    }

    @Tool(name = "add_report_column", value = "Append a column to a report")
    public String addReportColumn(@P("Name of the report") String reportName,
                                  @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                  @P("The column: name plus attributes such as sourceObjectName and sourcePropertyName") Map<String, Object> column) {
        return addChild("add_report_column", REPORT, reportName, ownerObjectName, "column", column);
    }

    @Tool(name = "update_report_column", value = "Merge attributes into a report column")
    public String updateReportColumn(@P("Name of the report") String reportName,
                                     @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                     @P("Name of the column") String columnName,
                                     @P("Attributes to set") Map<String, Object> updates) {
        return updateChild("update_report_column", REPORT, reportName, ownerObjectName, "column_name", columnName, updates);
    }

    @Tool(name = "move_report_column", value = "Move a report column to a new 0-based position")
    public String moveReportColumn(@P("Name of the report") String reportName,
                                   @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                   @P("Name of the column") String columnName,
                                   @P("Target position, 0-based") Integer newPosition) {
        return moveChild("move_report_column", REPORT, reportName, ownerObjectName, "column_name", columnName, newPosition);
    }

    @Tool(name = "add_report_button", value = "Append a button to a report")
    public String addReportButton(@P("Name of the report") String reportName,
                                  @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                  @P("The button: buttonName plus attributes such as buttonText and buttonType") Map<String, Object> button) {
        return addChild("add_report_button", REPORT, reportName, ownerObjectName, "button", button);
    }

    @Tool(name = "update_report_button", value = "Merge attributes into a report button")
    public String updateReportButton(@P("Name of the report") String reportName,
                                     @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                     @P("buttonName of the button") String buttonName,
                                     @P("Attributes to set") Map<String, Object> updates) {
        return updateChild("update_report_button", REPORT, reportName, ownerObjectName, "button_name", buttonName, updates);
    }

    @Tool(name = "move_report_button", value = "Move a report button to a new 0-based position")
    public String moveReportButton(@P("Name of the report") String reportName,
                                   @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                   @P("buttonName of the button") String buttonName,
                                   @P("Target position, 0-based") Integer newPosition) {
        return moveChild("move_report_button", REPORT, reportName, ownerObjectName, "button_name", buttonName, newPosition);
    }

    @Tool(name = "get_report_schema", value = "Describe the attributes of a report, including the allowed visualization types")
    public String getReportSchema() {
        return schema("report");
    }
}
