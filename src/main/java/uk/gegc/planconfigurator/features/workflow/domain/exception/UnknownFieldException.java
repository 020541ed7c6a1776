package uk.gegc.planconfigurator.features.workflow.domain.exception;

public class UnknownFieldException extends RuntimeException {

    private final String stepId;
    private final String fieldId;

    public UnknownFieldException(String stepId, String fieldId) {
        super("Step '" + stepId + "' has no field '" + fieldId + "'");
        this.stepId = stepId;
        this.fieldId = fieldId;
    }

    public String getStepId() {
        return stepId;
    }

    public String getFieldId() {
        return fieldId;
    }
}
