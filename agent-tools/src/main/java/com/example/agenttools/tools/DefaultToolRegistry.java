package com.example.agenttools.tools;

import dev.langchain4j.agent.tool.Tool;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.agent.tool.ToolSpecifications;
import dev.langchain4j.service.tool.DefaultToolExecutor;
import dev.langchain4j.service.tool.ToolExecutor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default implementation of {@link ToolRegistry} over the model tool groups
 * ({@code data-objects}, {@code forms}, {@code reports}, {@code flows}, {@code lookups}, {@code model}).
 */
@Slf4j
public class DefaultToolRegistry implements ToolRegistry {

    private final Map<String, Object> tools;
    private final Map<String, ToolExecutor> executors = new LinkedHashMap<>();
    private final JsonMapper jsonMapper;

    public DefaultToolRegistry(Map<String, Object> tools, JsonMapper jsonMapper) {
        this.tools = new LinkedHashMap<>(tools);
        this.jsonMapper = jsonMapper;
        for (Object tool : this.tools.values()) {
            for (Method method : tool.getClass().getMethods()) {
                Tool annotation = method.getAnnotation(Tool.class);
                if (annotation == null) {
                    continue;
                }
                String name = annotation.name().isEmpty() ? method.getName() : annotation.name();
                if (executors.putIfAbsent(name, new DefaultToolExecutor(tool, method)) != null) {
                    throw new IllegalStateException("Duplicate tool name: " + name);
                }
            }
        }
        log.debug("Registered {} tools in {} groups", executors.size(), this.tools.size());
    }

    @Override
    public Object[] getTools(List<String> toolIds) {
        if (toolIds == null || toolIds.isEmpty()) {
            return new Object[0];
        }
        List<Object> result = new ArrayList<>();
        for (String id : toolIds) {
            Object tool = tools.get(id);
            if (tool != null) {
                result.add(tool);
            }
        }
        return result.toArray();
    }

    @Override
    public List<String> getAvailableToolIds() {
        return tools.keySet().stream().sorted().toList();
    }

    @Override
    public List<ToolSpecification> getToolSpecifications(List<String> toolIds) {
        List<ToolSpecification> specifications = new ArrayList<>();
        for (Object tool : getTools(toolIds)) {
            specifications.addAll(ToolSpecifications.toolSpecificationsFrom(tool));
        }
        return specifications;
    }

    /** Names of every registered tool, in registration order. */
    public List<String> getToolNames() {
        return List.copyOf(executors.keySet());
    }

    @Override
    public String execute(ToolExecutionRequest request) {
        ToolExecutor executor = executors.get(request.name());
        if (executor == null) {
            log.warn("Unknown tool requested: {}", request.name());
            return failure("unknown_tool", "No tool named '" + request.name() + "'");
        }
        try {
            log.debug("Executing tool {}", request.name());
            return executor.execute(request, "default");
        } catch (RuntimeException e) {
            log.warn("Tool {} rejected its arguments: {}", request.name(), e.getMessage());
            return failure("bad_arguments", e.getMessage());
        }
    }

    private String failure(String error, String note) {
        ObjectNode result = jsonMapper.createObjectNode();
        result.put("success", false);
        result.put("error", error);
        result.put("note", note);
        return jsonMapper.writeValueAsString(result);
    }
}
