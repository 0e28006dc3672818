package com.example.modelbridge.config;

import com.example.modelbridge.api.BridgeExceptionHandler;
import com.example.modelbridge.command.ChildItemOperations;
import com.example.modelbridge.command.CommandDispatcher;
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
import jakarta.validation.Validator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.json.JsonMapper;

import java.time.Duration;
import java.util.List;

@Configuration
public class BridgeConfiguration {

    @Bean
    public JsonMapper jsonMapper() {
        return JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .build();
    }

    @Bean
    public BridgeSettings bridgeSettings(
            @Value("${bridge.host:127.0.0.1}") String host,
            @Value("${bridge.data-port:3001}") int dataPort,
            @Value("${bridge.command-port:3002}") int commandPort,
            @Value("${bridge.max-port-attempts:10}") int maxPortAttempts,
            @Value("${bridge.port-retry-delay-ms:100}") long portRetryDelayMs) {
        return new BridgeSettings(host, dataPort, commandPort, maxPortAttempts, Duration.ofMillis(portRetryDelayMs));
    }

    @Bean
    public ModelDocumentStore modelDocumentStore(JsonMapper jsonMapper) {
        return new ModelDocumentStore(jsonMapper);
    }

    @Bean
    public EntityResolver entityResolver(ModelDocumentStore store) {
        return new EntityResolver(store);
    }

    @Bean
    public MutationValidator mutationValidator(ModelDocumentStore store, EntityResolver resolver) {
        return new MutationValidator(store, resolver);
    }

    @Bean
    public ReorderEngine reorderEngine(ModelDocumentStore store) {
        return new ReorderEngine(store);
    }

    @Bean
    public ModelQueries modelQueries(JsonMapper jsonMapper, ModelDocumentStore store, EntityResolver resolver) {
        return new ModelQueries(jsonMapper, store, resolver, new DataObjectUsageAnalyzer(jsonMapper, store));
    }

    @Bean
    public ModelSchemas modelSchemas(JsonMapper jsonMapper) {
        return new ModelSchemas(jsonMapper);
    }

    @Bean
    public BridgeExceptionHandler bridgeExceptionHandler(JsonMapper jsonMapper) {
        return new BridgeExceptionHandler(jsonMapper);
    }

    @Bean
    public CommandDispatcher commandDispatcher(
            JsonMapper jsonMapper,
            Validator validator,
            BridgeExceptionHandler exceptionHandler,
            ModelDocumentStore store,
            EntityResolver resolver,
            MutationValidator mutationValidator,
            ReorderEngine reorderEngine) {
        ChildItemOperations childItems = new ChildItemOperations(jsonMapper, store, resolver, mutationValidator, reorderEngine);
        return new CommandDispatcher(jsonMapper, validator, exceptionHandler, List.of(
                new DataObjectCommands(jsonMapper, store, resolver, mutationValidator, childItems),
                new WorkflowCommands(jsonMapper, store, resolver, mutationValidator),
                new WorkflowChildCommands(resolver, childItems),
                new LookupCommands(resolver, childItems),
                new RoleCommands(jsonMapper, resolver, childItems),
                new UserStoryCommands(jsonMapper, store, mutationValidator, new UserStoryValidator(store))
        ));
    }

    @Bean(destroyMethod = "stop")
    public ModelBridge modelBridge(
            BridgeSettings settings,
            ModelDocumentStore store,
            ModelQueries queries,
            ModelSchemas schemas,
            CommandDispatcher dispatcher,
            JsonMapper jsonMapper,
            BridgeExceptionHandler exceptionHandler) {
        return new ModelBridge(settings, store, queries, schemas, dispatcher, jsonMapper, exceptionHandler);
    }
}
