package uk.gegc.planconfigurator.features.validation.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.planconfigurator.features.validation.application.ValidationEngine;
import uk.gegc.planconfigurator.features.validation.domain.model.FieldRule;
import uk.gegc.planconfigurator.features.validation.domain.model.ReasonCodes;
import uk.gegc.planconfigurator.features.validation.domain.model.ServerCheck;
import uk.gegc.planconfigurator.features.validation.domain.model.StepValidationReport;
import uk.gegc.planconfigurator.features.validation.domain.model.ValidationResult;
import uk.gegc.planconfigurator.features.workflow.domain.model.FieldDefinition;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepCatalog;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepContext;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
@RequiredArgsConstructor
public class ValidationEngineImpl implements ValidationEngine {

    private final StepCatalog stepCatalog;

    @Override
    public ValidationResult validateField(String stepId, String fieldId, Object value) {
        FieldDefinition field = stepCatalog.step(stepId).field(fieldId);
        return validateLocally(field, value);
    }

    @Override
    public CompletableFuture<StepValidationReport> validateStep(String stepId, StepContext context, String authToken) {
        StepDefinition step = stepCatalog.step(stepId);
        List<FieldDefinition> visibleFields = step.visibleFields(context);

        Map<String, ValidationResult> localResults = new LinkedHashMap<>();
        for (FieldDefinition field : visibleFields) {
            localResults.put(field.id(), validateLocally(field, context.value(field.id())));
        }
        boolean localFailure = localResults.values().stream().anyMatch(result -> !result.isValid());
        if (localFailure) {
            log.debug("Step '{}' failed local validation; server checks not dispatched", stepId);
            return CompletableFuture.completedFuture(new StepValidationReport(stepId, localResults));
        }

        List<PendingCheck> pending = new ArrayList<>();
        for (FieldDefinition field : visibleFields) {
            Object value = context.value(field.id());
            if (value == null) {
                continue;
            }
            for (ServerCheck check : field.serverChecks()) {
                pending.add(new PendingCheck(field.id(), check.name(), check.check(value, context, authToken)));
            }
        }
        if (pending.isEmpty()) {
            return CompletableFuture.completedFuture(new StepValidationReport(stepId, localResults));
        }

        CompletableFuture<?>[] futures = pending.stream().map(PendingCheck::result).toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(futures).thenApply(ignored -> {
            Map<String, ValidationResult> results = new LinkedHashMap<>(localResults);
            for (PendingCheck check : pending) {
                ValidationResult result = check.result().join();
                // first non-valid result of a field wins
                if (results.get(check.fieldId()).isValid() && !result.isValid()) {
                    results.put(check.fieldId(), result);
                }
                log.debug("Server check '{}' for field '{}' -> {}", check.checkName(), check.fieldId(), result.status());
            }
            return new StepValidationReport(stepId, results);
        });
    }

    private ValidationResult validateLocally(FieldDefinition field, Object value) {
        if (isBlank(value)) {
            return field.required()
                    ? ValidationResult.invalid(ReasonCodes.REQUIRED, field.label() + " is required")
                    : ValidationResult.valid();
        }
        for (FieldRule rule : field.rules()) {
            ValidationResult result = rule.apply(value);
            if (!result.isValid()) {
                return result;
            }
        }
        return ValidationResult.valid();
    }

    private static boolean isBlank(Object value) {
        return value == null
                || (value instanceof String text && text.isBlank())
                || (value instanceof Map<?, ?> map && map.isEmpty());
    }

    private record PendingCheck(String fieldId, String checkName, CompletableFuture<ValidationResult> result) {
    }
}
