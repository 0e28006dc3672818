package com.example.modelbridge.command.args;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record UpdateDataObjectArgs(
        @JsonProperty("name") @JsonAlias("objectName") @NotBlank String name,
        @JsonProperty("codeDescription") @JsonAlias("code_description") @NotNull String codeDescription
) {
}
