package com.example.modelbridge.command.args;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import tools.jackson.databind.node.ObjectNode;

public record UpdateDataObjectPropArgs(
        @JsonProperty("objectName") @JsonAlias("object_name") @NotBlank String objectName,
        @JsonProperty("propName") @JsonAlias("prop_name") @NotBlank String propName,
        @JsonProperty("updateFields") @JsonAlias("updates") @NotNull ObjectNode updateFields
) {
}
