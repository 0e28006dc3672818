package com.example.modelbridge.command.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record CreateFormArgs(
        @JsonProperty("owner_object_name") @NotBlank String ownerObjectName,
        @JsonProperty("form_name") @NotBlank String formName,
        @JsonProperty("title_text") @NotBlank String titleText,
        @JsonProperty("role_required") String roleRequired,
        @JsonProperty("target_child_object") String targetChildObject
) {
}
