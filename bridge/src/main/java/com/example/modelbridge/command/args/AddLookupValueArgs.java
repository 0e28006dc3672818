package com.example.modelbridge.command.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import tools.jackson.databind.node.ObjectNode;

public record AddLookupValueArgs(
        @JsonProperty("lookup_object_name") @NotBlank String lookupObjectName,
        @JsonProperty("lookup_value") @NotNull ObjectNode lookupValue
) {
}
