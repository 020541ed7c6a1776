package uk.gegc.planconfigurator.features.workflow.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "UpdateFieldRequest", description = "New value of a workflow field; null or blank clears it")
public record UpdateFieldRequest(
        @Schema(description = "Field value: text, number, boolean, or a map of option code to quantity",
                example = "pro")
        Object value
) {
}
