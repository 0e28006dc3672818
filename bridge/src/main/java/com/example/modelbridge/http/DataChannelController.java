package com.example.modelbridge.http;

import com.example.modelbridge.api.EntityNotFoundException;
import com.example.modelbridge.document.WorkflowKind;
import com.example.modelbridge.query.ModelQueries;
import com.example.modelbridge.query.ModelSchemas;
import com.example.modelbridge.resolve.EntityResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tools.jackson.databind.JsonNode;

/**
 * Read-only endpoints of the data channel. Every query runs on the host's event thread.
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class DataChannelController {

    private final ModelQueries queries;
    private final ModelSchemas schemas;
    private final BridgeHealth health;
    private final BridgeEventLoop eventLoop;

    public DataChannelController(ModelQueries queries, ModelSchemas schemas, BridgeHealth health, BridgeEventLoop eventLoop) {
        this.queries = queries;
        this.schemas = schemas;
        this.health = health;
        this.eventLoop = eventLoop;
    }

    @GetMapping("/health")
    public ResponseEntity<JsonNode> health() {
        log.trace("Data channel health check");
        return ResponseEntity.ok(eventLoop.call(() -> health.report(ChannelType.DATA)));
    }

    @GetMapping("/model")
    public ResponseEntity<JsonNode> model() {
        return ResponseEntity.ok(eventLoop.call(queries::model));
    }

    @GetMapping("/objects")
    public ResponseEntity<JsonNode> objects() {
        return ResponseEntity.ok(eventLoop.call(queries::objects));
    }

    @GetMapping("/data-objects")
    public ResponseEntity<JsonNode> dataObjects(
            @RequestParam(name = "search_name", required = false) String searchName,
            @RequestParam(name = "is_lookup", required = false) String isLookup,
            @RequestParam(name = "parent_object_name", required = false) String parentObjectName) {
        return ResponseEntity.ok(eventLoop.call(() -> queries.dataObjectSummaries(searchName, isLookup, parentObjectName)));
    }

    @GetMapping("/data-objects/{name}")
    public ResponseEntity<JsonNode> dataObject(@PathVariable String name) {
        return ResponseEntity.ok(eventLoop.call(() -> queries.dataObject(name)
                .orElseThrow(() -> new EntityNotFoundException(EntityResolver.DATA_OBJECT, name, null))));
    }

    @GetMapping("/data-object-usage")
    public ResponseEntity<JsonNode> usageSummary() {
        return ResponseEntity.ok(eventLoop.call(queries::usageSummary));
    }

    @GetMapping("/data-object-usage/{name}")
    public ResponseEntity<JsonNode> usage(@PathVariable String name) {
        return ResponseEntity.ok(eventLoop.call(() -> queries.usage(name)
                .orElseThrow(() -> new EntityNotFoundException(EntityResolver.DATA_OBJECT, name, null))));
    }

    @GetMapping("/forms")
    public ResponseEntity<JsonNode> forms(@RequestParam(name = "form_name", required = false) String formName,
                                          @RequestParam(name = "owner_object_name", required = false) String owner) {
        return workflows(WorkflowKind.FORM, formName, owner);
    }

    @GetMapping("/reports")
    public ResponseEntity<JsonNode> reports(@RequestParam(name = "report_name", required = false) String reportName,
                                            @RequestParam(name = "owner_object_name", required = false) String owner) {
        return workflows(WorkflowKind.REPORT, reportName, owner);
    }

    @GetMapping("/general-flows")
    public ResponseEntity<JsonNode> generalFlows(
            @RequestParam(name = "general_flow_name", required = false) String flowName,
            @RequestParam(name = "owner_object_name", required = false) String owner) {
        return workflows(WorkflowKind.GENERAL_FLOW, flowName, owner);
    }

    @GetMapping("/page-init-flows")
    public ResponseEntity<JsonNode> pageInitFlows(
            @RequestParam(name = "page_init_flow_name", required = false) String flowName,
            @RequestParam(name = "owner_object_name", required = false) String owner) {
        return workflows(WorkflowKind.PAGE_INIT_FLOW, flowName, owner);
    }

    /** DynaFlow workflows; read-only, there are no workflow commands. */
    @GetMapping("/workflows")
    public ResponseEntity<JsonNode> dynaFlowWorkflows(
            @RequestParam(name = "workflow_name", required = false) String workflowName,
            @RequestParam(name = "owner_object_name", required = false) String owner) {
        return workflows(WorkflowKind.DYNA_FLOW, workflowName, owner);
    }

    @GetMapping("/lookup-values")
    public ResponseEntity<JsonNode> lookupValues(
            @RequestParam(name = "lookup_object_name", required = false) String lookupObjectName) {
        return ResponseEntity.ok(eventLoop.call(() -> queries.lookupValues(lookupObjectName)
                .orElseThrow(() -> new EntityNotFoundException(EntityResolver.DATA_OBJECT, lookupObjectName, null))));
    }

    @GetMapping("/roles")
    public ResponseEntity<JsonNode> roles() {
        return ResponseEntity.ok(eventLoop.call(queries::roles));
    }

    @GetMapping("/user-stories")
    public ResponseEntity<JsonNode> userStories() {
        return ResponseEntity.ok(eventLoop.call(queries::userStories));
    }

    @GetMapping("/schemas")
    public ResponseEntity<JsonNode> schemaKinds() {
        return ResponseEntity.ok(schemas.kinds());
    }

    @GetMapping("/schemas/{kind}")
    public ResponseEntity<JsonNode> schema(@PathVariable String kind) {
        return ResponseEntity.ok(schemas.schema(kind)
                .orElseThrow(() -> new EntityNotFoundException(ModelSchemas.SCHEMA, kind, null)));
    }

    @GetMapping("/resolve")
    public ResponseEntity<JsonNode> resolve(@RequestParam(required = false) String kind,
                                            @RequestParam(required = false) String name,
                                            @RequestParam(name = "owner_object_name", required = false) String owner) {
        if (kind == null || kind.isBlank() || name == null || name.isBlank()) {
            throw new IllegalArgumentException("kind and name query parameters are required");
        }
        return ResponseEntity.ok(eventLoop.call(() -> queries.describe(queries.resolve(kind, name, owner))));
    }

    private ResponseEntity<JsonNode> workflows(WorkflowKind kind, String name, String owner) {
        return ResponseEntity.ok(eventLoop.call(() -> queries.workflows(kind, name, owner)));
    }
}
