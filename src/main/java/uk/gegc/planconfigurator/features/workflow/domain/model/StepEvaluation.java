package uk.gegc.planconfigurator.features.workflow.domain.model;

import java.time.Instant;

/**
 * Audit entry: a step was evaluated on the way forward.
 */
public record StepEvaluation(String stepId, StepStatus outcome, Instant evaluatedAt) {
}
