package com.example.modelbridge.command.args;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record CreateDataObjectArgs(
        @JsonProperty("name") @NotBlank String name,
        @JsonProperty("parentObjectName") @JsonAlias("parent_object_name") @NotBlank String parentObjectName,
        @JsonProperty("isLookup") @JsonAlias("is_lookup") String isLookup,
        @JsonProperty("codeDescription") @JsonAlias("code_description") String codeDescription
) {
}
