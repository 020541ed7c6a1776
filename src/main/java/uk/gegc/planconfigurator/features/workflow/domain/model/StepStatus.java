package uk.gegc.planconfigurator.features.workflow.domain.model;

public enum StepStatus {
    NOT_VISITED,
    IN_PROGRESS,
    VALID,
    INVALID,
    /** Evaluated with zero visible fields and passed over automatically. */
    SKIPPED
}
