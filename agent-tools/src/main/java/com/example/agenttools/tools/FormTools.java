package com.example.agenttools.tools;

import com.example.agenttools.client.BridgeClient;
import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Tools for forms: pages with parameters, buttons and output variables.
 */
public class FormTools extends BridgeTools {

    private static final String FORM = "form_name";
    private static final String OWNER_HINT = "Data object owning the form; needed when several objects have a form of this name";

    public FormTools(BridgeClient client, JsonMapper jsonMapper) {
        super(client, jsonMapper);
    }

    @Tool(name = "list_forms", value = "List forms, each with its owning data object in _ownerObjectName")
    public String listForms(@P(value = "Exact form name (case-insensitive)", required = false) String formName,
                            @P(value = "Only forms owned by this data object", required = false) String ownerObjectName) {
        return list("/api/forms", filters(FORM, formName, "owner_object_name", ownerObjectName),
                "forms", "Forms loaded from the model via the data channel");
    }

    @Tool(name = "get_form", value = "Get one form with its parameters, buttons and output variables")
    public String getForm(@P("Name of the form") String formName,
                          @P(value = OWNER_HINT, required = false) String ownerObjectName) {
        return single("/api/forms", filters(FORM, formName, "owner_object_name", ownerObjectName), "form", "Form", formName);
    }

    @Tool(name = "create_form", value = "Create a form on a data object. Also creates its page init flow "
            + "(<form_name>InitObjWF) and OK/Cancel buttons.")
    public String createForm(@P("Data object that owns the form") String ownerObjectName,
                             @P("PascalCase form name, unique in the model") String formName,
                             @P("Title shown on the form, at most 100 characters") String titleText,
                             @P(value = "Role required to open the form, a value of the Role lookup", required = false) String roleRequired,
                             @P(value = "Data object the form targets", required = false) String targetChildObject) {
        ObjectNode args = args();
        putIfPresent(args, "owner_object_name", ownerObjectName);
        putIfPresent(args, FORM, formName);
        putIfPresent(args, "title_text", titleText);
        putIfPresent(args, "role_required", roleRequired);
        putIfPresent(args, "target_child_object", targetChildObject);
        return command("create_form", args);
    }

    @Tool(name = "update_form", value = "Merge attributes such as titleText or roleRequired into a form. "
            + "The name, isPage and child lists cannot be changed this way.")
    public String updateForm(@P("Name of the form") String formName,
                             @P(value = OWNER_HINT, required = false) String ownerObjectName,
                             @P("Attributes to set") Map<String, Object> updates) {
        ObjectNode args = workflowArgs(FORM, formName, ownerObjectName);
        args.set("updates", toNode(updates));
        return command("update_form", args);
    }

    @Tool(name = "add_form_param", value = "Append an input parameter to a form")
    public String addFormParam(@P("Name of the form") String formName,
                               @P(value = OWNER_HINT, required = false) String ownerObjectName,
                               @P("The parameter: PascalCase name plus attributes such as sqlServerDBDataType, labelText, isRequired") Map<String, Object> param) {
        return addChild("add_form_param", FORM, formName, ownerObjectName, "param", param);
    }

    @Tool(name = "update_form_param", value = "Merge attributes into a form parameter")
    public String updateFormParam(@P("Name of the form") String formName,
                                  @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                  @P("Name of the parameter") String paramName,
                                  @P("Attributes to set") Map<String, Object> updates) {
        return updateChild("update_form_param", FORM, formName, ownerObjectName, "param_name", paramName, updates);
    }

    @Tool(name = "move_form_param", value = "Move a form parameter to a new 0-based position")
    public String moveFormParam(@P("Name of the form") String formName,
                                @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                @P("Name of the parameter") String paramName,
                                @P("Target position, 0-based") Integer newPosition) {
        return moveChild("move_form_param", FORM, formName, ownerObjectName, "param_name", paramName, newPosition);
    }

    @Tool(name = "add_form_button", value = "Append a button to a form")
    public String addFormButton(@P("Name of the form") String formName,
                                @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                @P("The button: buttonName plus attributes such as buttonText and buttonType") Map<String, Object> button) {
        return addChild("add_form_button", FORM, formName, ownerObjectName, "button", button);
    }

    @Tool(name = "update_form_button", value = "Merge attributes such as buttonText or isVisible into a form button")
    public String updateFormButton(@P("Name of the form") String formName,
                                   @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                   @P("buttonName of the button") String buttonName,
                                   @P("Attributes to set") Map<String, Object> updates) {
        return updateChild("update_form_button", FORM, formName, ownerObjectName, "button_name", buttonName, updates);
    }

    @Tool(name = "move_form_button", value = "Move a form button to a new 0-based position")
    public String moveFormButton(@P("Name of the form") String formName,
                                 @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                 @P("buttonName of the button") String buttonName,
                                 @P("Target position, 0-based") Integer newPosition) {
        return moveChild("move_form_button", FORM, formName, ownerObjectName, "button_name", buttonName, newPosition);
    }

    @Tool(name = "add_form_output_var", value = "Append an output variable to a form")
    public String addFormOutputVar(@P("Name of the form") String formName,
                                   @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                   @P("The output variable: PascalCase name plus attributes") Map<String, Object> outputVar) {
        return addChild("add_form_output_var", FORM, formName, ownerObjectName, "output_var", outputVar);
    }

    @Tool(name = "update_form_output_var", value = "Merge attributes into a form output variable")
    public String updateFormOutputVar(@P("Name of the form") String formName,
                                      @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                      @P("Name of the output variable") String outputVarName,
                                      @P("Attributes to set") Map<String, Object> updates) {
        return updateChild("update_form_output_var", FORM, formName, ownerObjectName, "output_var_name", outputVarName, updates);
    }

    @Tool(name = "move_form_output_var", value = "Move a form output variable to a new 0-based position")
    public String moveFormOutputVar(@P("Name of the form") String formName,
                                    @P(value = OWNER_HINT, required = false) String ownerObjectName,
                                    @P("Name of the output variable") String outputVarName,
                                    @P("Target position, 0-based") Integer newPosition) {
        return moveChild("move_form_output_var", FORM, formName, ownerObjectName, "output_var_name", outputVarName, newPosition);
    }

    @Tool(name = "get_form_schema", value = "Describe the attributes of a form and its child lists")
    public String getFormSchema() {
        return schema("form");
    }
}
