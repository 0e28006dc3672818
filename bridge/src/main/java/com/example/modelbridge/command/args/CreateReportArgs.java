package com.example.modelbridge.command.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record CreateReportArgs(
        @JsonProperty("owner_object_name") @NotBlank String ownerObjectName,
        @JsonProperty("report_name") @NotBlank String reportName,
        @JsonProperty("title_text") @NotBlank String titleText,
        @JsonProperty("visualization_type") String visualizationType,
        @JsonProperty("role_required") String roleRequired,
        @JsonProperty("target_child_object") String targetChildObject
) {
}
