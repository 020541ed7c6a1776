package uk.gegc.planconfigurator.features.plan.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "RenamePlanRequest", description = "New display name of a plan")
public record RenamePlanRequest(
        @Schema(description = "Plan name, unique per account", example = "Acme production")
        @NotBlank(message = "Plan name must not be blank")
        @Size(max = 80, message = "Plan name must be at most 80 characters")
        String planName
) {
}
