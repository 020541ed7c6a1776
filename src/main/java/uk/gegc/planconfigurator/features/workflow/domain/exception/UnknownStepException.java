package uk.gegc.planconfigurator.features.workflow.domain.exception;

public class UnknownStepException extends RuntimeException {

    private final String stepId;

    public UnknownStepException(String stepId) {
        super("Unknown workflow step: " + stepId);
        this.stepId = stepId;
    }

    public String getStepId() {
        return stepId;
    }
}
