package com.example.modelbridge.command.args;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record UpdateRoleArgs(
        @JsonProperty("name") @JsonAlias("role_name") @NotBlank String name,
        @JsonProperty("displayName") @JsonAlias("display_name") String displayName,
        @JsonProperty("description") String description,
        @JsonProperty("isActive") @JsonAlias("is_active") String isActive
) {
}
