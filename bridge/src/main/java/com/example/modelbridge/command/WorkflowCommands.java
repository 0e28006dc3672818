package com.example.modelbridge.command;

import com.example.modelbridge.command.args.CreateFormArgs;
import com.example.modelbridge.command.args.CreateGeneralFlowArgs;
import com.example.modelbridge.command.args.CreateReportArgs;
import com.example.modelbridge.command.args.UpdateWorkflowArgs;
import com.example.modelbridge.document.ChildCollection;
import com.example.modelbridge.document.ModelDocumentStore;
import com.example.modelbridge.document.ModelKeys;
import com.example.modelbridge.document.ModelNodes;
import com.example.modelbridge.document.WorkflowKind;
import com.example.modelbridge.resolve.EntityResolver;
import com.example.modelbridge.resolve.ResolvedEntity;
import com.example.modelbridge.validation.MutationValidator;
import com.example.modelbridge.validation.ValidationError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Commands creating and updating forms, reports, general flows and page init flows.
 * <p>
 * Creating a form or report also creates its page init flow and default buttons in the same atomic change.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class WorkflowCommands implements CommandGroup {

    static final String DEFAULT_VISUALIZATION = "Grid";

    /** Flags deciding the kind of a workflow; updates may not change them. */
    private static final Set<String> KIND_FLAGS = Set.of(ModelKeys.IS_PAGE, ModelKeys.IS_DYNA_FLOW, ModelKeys.IS_DYNA_FLOW_TASK);

    private final JsonMapper jsonMapper;
    private final ModelDocumentStore store;
    private final EntityResolver resolver;
    private final MutationValidator validator;

    @Override
    public List<CommandDefinition<?>> commands() {
        List<CommandDefinition<?>> commands = new ArrayList<>();
        commands.add(CommandDefinition.mutation("create_form",
                "Create a form with its page init flow and OK/Cancel buttons", CreateFormArgs.class, this::createForm));
        commands.add(CommandDefinition.mutation("create_report",
                "Create a report with its page init flow and Back button", CreateReportArgs.class, this::createReport));
        commands.add(CommandDefinition.mutation("create_general_flow",
                "Create a general flow", CreateGeneralFlowArgs.class, this::createGeneralFlow));
        for (WorkflowKind kind : EnumSet.of(WorkflowKind.FORM, WorkflowKind.REPORT, WorkflowKind.GENERAL_FLOW,
                WorkflowKind.PAGE_INIT_FLOW)) {
            String noun = WorkflowChildCommands.commandNoun(kind);
            commands.add(CommandDefinition.<UpdateWorkflowArgs>mutation("update_" + noun,
                            "Merge attributes into a " + kind.label(), UpdateWorkflowArgs.class,
                            args -> updateWorkflow(kind, args))
                    .withArgumentLabels(Map.of("workflow_name", noun + "_name")));
        }
        return commands;
    }

    ObjectNode createForm(CreateFormArgs args) {
        ResolvedEntity owner = resolver.resolveObject(args.ownerObjectName()).orElseThrow();
        String initName = args.formName() + WorkflowKind.FORM_INIT_SUFFIX;
        List<ValidationError> errors = new ArrayList<>();
        validator.checkNewWorkflowName(WorkflowKind.FORM, args.formName(), "form_name", errors);
        checkInitNameFree(initName, "form_name", errors);
        validator.checkTitle(args.titleText(), "title_text", errors);
        validator.checkRole(args.roleRequired(), "role_required", errors);
        validator.checkObjectReference(args.targetChildObject(), "target_child_object", errors);
        MutationValidator.throwIfInvalid(errors);

        ObjectNode form = pageHeader(args.formName(), args.titleText(), args.roleRequired(), args.targetChildObject(), initName);
        form.putArray(ModelKeys.WORKFLOW_PARAM);
        ArrayNode buttons = form.putArray(ModelKeys.WORKFLOW_BUTTON);
        buttons.add(button("OK", "submit"));
        buttons.add(button("Cancel", "cancel"));
        form.putArray(ModelKeys.WORKFLOW_OUTPUT_VAR);
        ObjectNode initFlow = pageInitFlow(initName, args.titleText());

        store.applyAtomically("create form " + args.formName(), () -> {
            ArrayNode workflows = store.ensureList(owner.node(), ModelKeys.OBJECT_WORKFLOW);
            store.insert(workflows, form);
            store.insert(workflows, initFlow);
            return form;
        });
        log.info("Created form name={} owner={} pageInit={}", args.formName(), args.ownerObjectName(), initName);

        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("message", "Created form '" + args.formName() + "' in '" + args.ownerObjectName() + "'");
        payload.put("form_name", args.formName());
        payload.put("page_init_flow_name", initName);
        payload.put("owner_object_name", owner.ownerObjectName());
        payload.set("form", form.deepCopy());
        return payload;
    }

    ObjectNode createReport(CreateReportArgs args) {
        ResolvedEntity owner = resolver.resolveObject(args.ownerObjectName()).orElseThrow();
        String initName = args.reportName() + WorkflowKind.REPORT_INIT_SUFFIX;
        String visualization = args.visualizationType() != null ? args.visualizationType() : DEFAULT_VISUALIZATION;
        List<ValidationError> errors = new ArrayList<>();
        validator.checkNewWorkflowName(WorkflowKind.REPORT, args.reportName(), "report_name", errors);
        checkInitNameFree(initName, "report_name", errors);
        validator.checkTitle(args.titleText(), "title_text", errors);
        validator.checkVisualizationType(visualization, "visualization_type", errors);
        validator.checkRole(args.roleRequired(), "role_required", errors);
        validator.checkObjectReference(args.targetChildObject(), "target_child_object", errors);
        MutationValidator.throwIfInvalid(errors);

        ObjectNode report = pageHeader(args.reportName(), args.titleText(), args.roleRequired(), args.targetChildObject(), initName);
        report.put(ModelKeys.VISUALIZATION_TYPE, visualization);
        report.put("isCustomSqlUsed", ModelKeys.FALSE);
        report.putArray(ModelKeys.REPORT_PARAM);
        report.putArray(ModelKeys.REPORT_COLUMN);
        report.putArray(ModelKeys.REPORT_BUTTON).add(button("Back", "back"));
        ObjectNode initFlow = pageInitFlow(initName, args.titleText());

        store.applyAtomically("create report " + args.reportName(), () -> {
            store.insert(store.ensureList(owner.node(), ModelKeys.REPORT), report);
            store.insert(store.ensureList(owner.node(), ModelKeys.OBJECT_WORKFLOW), initFlow);
            return report;
        });
        log.info("Created report name={} owner={} visualization={}", args.reportName(), args.ownerObjectName(), visualization);

        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("message", "Created report '" + args.reportName() + "' in '" + args.ownerObjectName() + "'");
        payload.put("report_name", args.reportName());
        payload.put("page_init_flow_name", initName);
        payload.put("owner_object_name", owner.ownerObjectName());
        payload.set("report", report.deepCopy());
        return payload;
    }

    ObjectNode createGeneralFlow(CreateGeneralFlowArgs args) {
        ResolvedEntity owner = resolver.resolveObject(args.ownerObjectName()).orElseThrow();
        List<ValidationError> errors = new ArrayList<>();
        validator.checkNewWorkflowName(WorkflowKind.GENERAL_FLOW, args.generalFlowName(), "general_flow_name", errors);
        MutationValidator.throwIfInvalid(errors);

        ObjectNode flow = jsonMapper.createObjectNode();
        flow.put(ModelKeys.NAME, args.generalFlowName());
        flow.put(ModelKeys.IS_PAGE, ModelKeys.FALSE);
        if (!ModelNodes.isBlank(args.codeDescription())) {
            flow.put(ModelKeys.CODE_DESCRIPTION, args.codeDescription());
        }
        flow.putArray(ModelKeys.WORKFLOW_PARAM);
        flow.putArray(ModelKeys.WORKFLOW_OUTPUT_VAR);

        store.applyAtomically("create general flow " + args.generalFlowName(),
                () -> store.insert(store.ensureList(owner.node(), ModelKeys.OBJECT_WORKFLOW), flow));
        log.info("Created general flow name={} owner={}", args.generalFlowName(), args.ownerObjectName());

        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("message", "Created general flow '" + args.generalFlowName() + "' in '" + args.ownerObjectName() + "'");
        payload.put("general_flow_name", args.generalFlowName());
        payload.put("owner_object_name", owner.ownerObjectName());
        payload.set("general_flow", flow.deepCopy());
        return payload;
    }

    ObjectNode updateWorkflow(WorkflowKind kind, UpdateWorkflowArgs args) {
        String noun = WorkflowChildCommands.commandNoun(kind);
        ResolvedEntity workflow = resolver.resolveWorkflow(kind, args.workflowName(), args.ownerObjectName())
                .requireUnambiguous();
        ObjectNode updates = args.updates();
        List<ValidationError> errors = new ArrayList<>();
        if (updates.isEmpty()) {
            errors.add(new ValidationError("updates", "updates must contain at least one field"));
        }
        for (ChildCollection collection : ChildCollection.values()) {
            if (collection.workflowKind() == kind && updates.has(collection.listKey())) {
                errors.add(new ValidationError("updates." + collection.listKey(), "use the add_" + noun + "_"
                        + collection.argumentName() + " and move_" + noun + "_" + collection.argumentName()
                        + " commands to change " + collection.listKey()));
            }
        }
        for (String flag : KIND_FLAGS) {
            if (updates.has(flag) && !ModelNodes.text(updates, flag).equals(ModelNodes.text(workflow.node(), flag))) {
                errors.add(new ValidationError("updates." + flag, flag + " decides the kind of a " + kind.label()
                        + " and cannot be changed"));
            }
        }
        validator.checkEnumerations(updates, "updates", errors);
        if (updates.has(ModelKeys.TITLE_TEXT)) {
            validator.checkTitle(ModelNodes.text(updates, ModelKeys.TITLE_TEXT), "updates." + ModelKeys.TITLE_TEXT, errors);
        }
        validator.checkRole(ModelNodes.text(updates, ModelKeys.ROLE_REQUIRED), "updates." + ModelKeys.ROLE_REQUIRED, errors);
        validator.checkObjectReference(ModelNodes.text(updates, ModelKeys.TARGET_CHILD_OBJECT),
                "updates." + ModelKeys.TARGET_CHILD_OBJECT, errors);
        MutationValidator.throwIfInvalid(errors);

        String name = ModelNodes.name(workflow.node());
        store.applyAtomically("update " + kind.label() + " " + name,
                () -> store.update(workflow.node(), updates, ModelKeys.NAME));
        List<String> updated = new ArrayList<>();
        updates.properties().forEach(field -> {
            if (!ModelKeys.NAME.equals(field.getKey())) {
                updated.add(field.getKey());
            }
        });
        log.info("Updated {} name={} owner={} fields={}", kind.label(), name, workflow.ownerObjectName(), updated);

        ObjectNode payload = jsonMapper.createObjectNode();
        payload.put("message", "Updated " + kind.label() + " '" + name + "'");
        payload.put(noun + "_name", name);
        payload.put("owner_object_name", workflow.ownerObjectName());
        ArrayNode fields = payload.putArray("updatedFields");
        updated.forEach(fields::add);
        return payload;
    }

    private void checkInitNameFree(String initName, String field, List<ValidationError> errors) {
        if (resolver.workflowNameExists(initName)) {
            errors.add(new ValidationError(field, "page init flow '" + initName + "' already exists"));
        }
    }

    private ObjectNode pageHeader(String name, String title, String role, String targetChildObject, String initName) {
        ObjectNode page = jsonMapper.createObjectNode();
        page.put(ModelKeys.NAME, name);
        page.put(ModelKeys.TITLE_TEXT, title);
        page.put(ModelKeys.IS_PAGE, ModelKeys.TRUE);
        page.put("isAuthorizationRequired", ModelNodes.isBlank(role) ? ModelKeys.FALSE : ModelKeys.TRUE);
        if (!ModelNodes.isBlank(role)) {
            page.put(ModelKeys.ROLE_REQUIRED, role);
        }
        if (!ModelNodes.isBlank(targetChildObject)) {
            page.put(ModelKeys.TARGET_CHILD_OBJECT, targetChildObject);
        }
        page.put(ModelKeys.INIT_OBJECT_WORKFLOW_NAME, initName);
        return page;
    }

    private ObjectNode pageInitFlow(String initName, String title) {
        ObjectNode flow = jsonMapper.createObjectNode();
        flow.put(ModelKeys.NAME, initName);
        flow.put(ModelKeys.TITLE_TEXT, title + " Init");
        flow.put(ModelKeys.IS_PAGE, ModelKeys.FALSE);
        flow.putArray(ModelKeys.WORKFLOW_OUTPUT_VAR);
        return flow;
    }

    private ObjectNode button(String name, String type) {
        return jsonMapper.createObjectNode()
                .put(ModelKeys.BUTTON_NAME, name)
                .put("buttonText", name)
                .put("buttonType", type)
                .put("isVisible", ModelKeys.TRUE);
    }
}
