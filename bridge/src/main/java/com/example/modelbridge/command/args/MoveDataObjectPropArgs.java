package com.example.modelbridge.command.args;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record MoveDataObjectPropArgs(
        @JsonProperty("objectName") @JsonAlias("object_name") @NotBlank String objectName,
        @JsonProperty("propName") @JsonAlias("prop_name") @NotBlank String propName,
        @JsonProperty("new_position") @JsonAlias({"newPosition", "new_index"}) @NotNull Integer newPosition
) {
}
