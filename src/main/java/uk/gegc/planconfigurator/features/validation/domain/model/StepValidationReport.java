package uk.gegc.planconfigurator.features.validation.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Results of validating every visible field of a step, in field order.
 */
public record StepValidationReport(String stepId, Map<String, ValidationResult> fieldResults) {

    public StepValidationReport {
        fieldResults = Collections.unmodifiableMap(new LinkedHashMap<>(fieldResults));
    }

    /**
     * True when every visible field is valid and no check is pending.
     */
    public boolean advanceable() {
        return fieldResults.values().stream().allMatch(ValidationResult::isValid);
    }

    @JsonIgnore
    public Optional<Map.Entry<String, ValidationResult>> firstFailure() {
        return fieldResults.entrySet().stream()
                .filter(entry -> !entry.getValue().isValid())
                .findFirst();
    }
}
