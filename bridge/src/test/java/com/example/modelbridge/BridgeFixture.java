package com.example.modelbridge;

import com.example.modelbridge.api.BridgeExceptionHandler;
import com.example.modelbridge.command.ChildItemOperations;
import com.example.modelbridge.command.CommandDispatcher;
import com.example.modelbridge.command.CommandResult;
import com.example.modelbridge.command.DataObjectCommands;
import com.example.modelbridge.command.LookupCommands;
import com.example.modelbridge.command.RoleCommands;
import com.example.modelbridge.command.UserStoryCommands;
import com.example.modelbridge.command.WorkflowChildCommands;
import com.example.modelbridge.command.WorkflowCommands;
import com.example.modelbridge.document.ModelDocumentStore;
import com.example.modelbridge.http.BridgeSettings;
import com.example.modelbridge.http.ModelBridge;
import com.example.modelbridge.query.DataObjectUsageAnalyzer;
import com.example.modelbridge.query.ModelQueries;
import com.example.modelbridge.query.ModelSchemas;
import com.example.modelbridge.reorder.ReorderEngine;
import com.example.modelbridge.resolve.EntityResolver;
import com.example.modelbridge.validation.MutationValidator;
import com.example.modelbridge.validation.UserStoryValidator;
import jakarta.validation.Validation;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;

/**
 * The bridge's object graph wired by hand around one document store, for tests.
 */
public final class BridgeFixture {

    public final JsonMapper jsonMapper;
    public final ModelDocumentStore store;
    public final EntityResolver resolver;
    public final MutationValidator validator;
    public final ReorderEngine reorderEngine;
    public final ModelQueries queries;
    public final ModelSchemas schemas;
    public final BridgeExceptionHandler exceptionHandler;
    public final CommandDispatcher dispatcher;

    private BridgeFixture(ObjectNode model) {
        this.jsonMapper = newJsonMapper();
        this.store = new ModelDocumentStore(jsonMapper);
        if (model != null) {
            store.open(model, "test-model.json");
        }
        this.resolver = new EntityResolver(store);
        this.validator = new MutationValidator(store, resolver);
        this.reorderEngine = new ReorderEngine(store);
        this.queries = new ModelQueries(jsonMapper, store, resolver, new DataObjectUsageAnalyzer(jsonMapper, store));
        this.schemas = new ModelSchemas(jsonMapper);
        this.exceptionHandler = new BridgeExceptionHandler(jsonMapper);
        ChildItemOperations childItems = new ChildItemOperations(jsonMapper, store, resolver, validator, reorderEngine);
        this.dispatcher = new CommandDispatcher(jsonMapper, Validation.buildDefaultValidatorFactory().getValidator(),
                exceptionHandler, List.of(
                        new DataObjectCommands(jsonMapper, store, resolver, validator, childItems),
                        new WorkflowCommands(jsonMapper, store, resolver, validator),
                        new WorkflowChildCommands(resolver, childItems),
                        new LookupCommands(resolver, childItems),
                        new RoleCommands(jsonMapper, resolver, childItems),
                        new UserStoryCommands(jsonMapper, store, validator, new UserStoryValidator(store))));
    }

    public static BridgeFixture withTestModel() {
        JsonMapper mapper = newJsonMapper();
        try (InputStream in = BridgeFixture.class.getResourceAsStream("/models/test-model.json")) {
            if (in == null) {
                throw new IllegalStateException("models/test-model.json missing from test resources");
            }
            return new BridgeFixture((ObjectNode) mapper.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static BridgeFixture withEmptyModel() {
        return new BridgeFixture(null);
    }

    public static JsonMapper newJsonMapper() {
        return JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .build();
    }

    public static BridgeSettings ephemeralPorts() {
        return new BridgeSettings("127.0.0.1", 0, 0, 10, Duration.ofMillis(20));
    }

    public CommandResult execute(String command, String argsJson) {
        return dispatcher.execute(command, json(argsJson));
    }

    public JsonNode json(String text) {
        return jsonMapper.readTree(text);
    }

    public ObjectNode object(String name) {
        return resolver.resolveObject(name).orElseThrow().node();
    }

    public ModelBridge newBridge(BridgeSettings settings) {
        return new ModelBridge(settings, store, queries, schemas, dispatcher, jsonMapper, exceptionHandler);
    }
}
