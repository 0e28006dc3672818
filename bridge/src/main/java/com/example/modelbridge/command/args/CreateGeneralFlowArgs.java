package com.example.modelbridge.command.args;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record CreateGeneralFlowArgs(
        @JsonProperty("owner_object_name") @NotBlank String ownerObjectName,
        @JsonProperty("general_flow_name") @NotBlank String generalFlowName,
        @JsonProperty("codeDescription") @JsonAlias("code_description") String codeDescription
) {
}
