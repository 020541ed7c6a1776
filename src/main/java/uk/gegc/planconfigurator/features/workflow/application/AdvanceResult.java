package uk.gegc.planconfigurator.features.workflow.application;

import uk.gegc.planconfigurator.features.validation.domain.model.StepValidationReport;

/**
 * @param report validation report of the step that was left or blocked; {@code null} when
 *               no validation ran (entering the first step, already completed)
 */
public record AdvanceResult(Outcome outcome, WorkflowView view, StepValidationReport report) {

    public enum Outcome {
        /** Moved to the next visible step. */
        ADVANCED,
        /** Reached the terminal state, or was already there. */
        COMPLETED,
        /** Validation failed; position unchanged. */
        BLOCKED,
        /** A newer action overtook this advance; its result was dropped. */
        SUPERSEDED
    }
}
