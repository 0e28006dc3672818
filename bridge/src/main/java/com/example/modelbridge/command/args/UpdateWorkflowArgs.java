package com.example.modelbridge.command.args;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import tools.jackson.databind.node.ObjectNode;

/**
 * Shared by the update commands of forms, reports and flows; each command names the workflow
 * with its own argument ({@code form_name}, {@code report_name}, ...).
 */
public record UpdateWorkflowArgs(
        @JsonProperty("workflow_name")
        @JsonAlias({"form_name", "report_name", "general_flow_name", "page_init_flow_name"})
        @NotBlank String workflowName,
        @JsonProperty("owner_object_name") String ownerObjectName,
        @JsonProperty("updates") @NotNull ObjectNode updates
) {
}
