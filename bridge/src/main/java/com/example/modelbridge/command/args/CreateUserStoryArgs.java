package com.example.modelbridge.command.args;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record CreateUserStoryArgs(
        @JsonProperty("storyText") @JsonAlias("story_text") @NotBlank String storyText,
        @JsonProperty("storyNumber") @JsonAlias("story_number") String storyNumber
) {
}
