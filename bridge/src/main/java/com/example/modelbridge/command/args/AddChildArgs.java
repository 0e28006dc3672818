package com.example.modelbridge.command.args;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import tools.jackson.databind.node.ObjectNode;

public record AddChildArgs(
        @JsonProperty("workflow_name")
        @JsonAlias({"form_name", "report_name", "general_flow_name", "page_init_flow_name"})
        @NotBlank String workflowName,
        @JsonProperty("owner_object_name") String ownerObjectName,
        @JsonProperty("item") @JsonAlias({"param", "button", "column", "output_var"}) @NotNull ObjectNode item
) {
}
