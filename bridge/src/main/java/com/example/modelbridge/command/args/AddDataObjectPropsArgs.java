package com.example.modelbridge.command.args;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import tools.jackson.databind.JsonNode;

import java.util.List;

/**
 * Elements of {@code props} are checked individually so that a non-object element is reported
 * against its index.
 */
public record AddDataObjectPropsArgs(
        @JsonProperty("objectName") @JsonAlias("object_name") @NotBlank String objectName,
        @JsonProperty("props") @NotEmpty List<JsonNode> props
) {
}
