package com.example.modelbridge.command.args;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Identifies a story by its {@code name} (the generated id) and sets its ignore flag.
 */
public record UpdateUserStoryArgs(
        @JsonProperty("name") @JsonAlias("story_name") @NotBlank String name,
        @JsonProperty("isIgnored") @JsonAlias("is_ignored") @NotBlank String isIgnored
) {
}
