package com.example.modelbridge.command.args;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record MoveLookupValueArgs(
        @JsonProperty("lookup_object_name") @NotBlank String lookupObjectName,
        @JsonProperty("lookup_value_name") @NotBlank String lookupValueName,
        @JsonProperty("new_position") @JsonAlias({"newPosition", "new_index"}) @NotNull Integer newPosition
) {
}
