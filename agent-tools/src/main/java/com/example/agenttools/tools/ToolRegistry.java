package com.example.agenttools.tools;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;

import java.util.List;

/**
 * Registry of model tools by id. An agent picks tool groups by id, reads their specifications
 * and invokes single tools by name.
 */
public interface ToolRegistry {

    /**
     * Returns tool instances for the given ids, in order. Unknown ids are skipped.
     */
    Object[] getTools(List<String> toolIds);

    /**
     * Returns the ids of all registered tool groups, sorted.
     */
    List<String> getAvailableToolIds();

    /**
     * Specifications (name, description, JSON schema of the parameters) of every tool in the given groups.
     */
    List<ToolSpecification> getToolSpecifications(List<String> toolIds);

    /**
     * Runs the tool named in the request. Always answers with a JSON object carrying {@code success}.
     */
    String execute(ToolExecutionRequest request);
}
