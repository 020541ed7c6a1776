package uk.gegc.planconfigurator.features.validation.application;

import uk.gegc.planconfigurator.features.validation.domain.model.StepValidationReport;
import uk.gegc.planconfigurator.features.validation.domain.model.ValidationResult;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepContext;

import java.util.concurrent.CompletableFuture;

/**
 * Evaluates field and step rules. Reads snapshots only; never mutates workflow state.
 */
public interface ValidationEngine {

    /**
     * Local rules of one field. Synchronous; never calls the backend.
     *
     * @throws uk.gegc.planconfigurator.features.workflow.domain.exception.UnknownStepException  for an unknown step
     * @throws uk.gegc.planconfigurator.features.workflow.domain.exception.UnknownFieldException for a field outside the step
     */
    ValidationResult validateField(String stepId, String fieldId, Object value);

    /**
     * Every field visible under the step's predicates: local rules first, then, only if all
     * of them passed, the server checks in parallel.
     */
    CompletableFuture<StepValidationReport> validateStep(String stepId, StepContext context, String authToken);
}
