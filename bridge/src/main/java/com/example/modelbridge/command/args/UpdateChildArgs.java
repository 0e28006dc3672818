package com.example.modelbridge.command.args;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import tools.jackson.databind.node.ObjectNode;

public record UpdateChildArgs(
        @JsonProperty("workflow_name")
        @JsonAlias({"form_name", "report_name", "general_flow_name", "page_init_flow_name"})
        @NotBlank String workflowName,
        @JsonProperty("owner_object_name") String ownerObjectName,
        @JsonProperty("item_name") @JsonAlias({"param_name", "button_name", "column_name", "output_var_name"})
        @NotBlank String itemName,
        @JsonProperty("updates") @NotNull ObjectNode updates
) {
}
