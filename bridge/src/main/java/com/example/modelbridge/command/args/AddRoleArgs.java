package com.example.modelbridge.command.args;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * A new value of the {@code Role} lookup. displayName and description default to the name split
 * into words; isActive defaults to {@code "true"}.
 */
public record AddRoleArgs(
        @JsonProperty("name") @JsonAlias("role_name") @NotBlank String name,
        @JsonProperty("displayName") @JsonAlias("display_name") String displayName,
        @JsonProperty("description") String description,
        @JsonProperty("isActive") @JsonAlias("is_active") String isActive
) {
}
