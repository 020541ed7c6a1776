package uk.gegc.planconfigurator.features.workflow.infra.persistence;

public class WorkflowStateSerializationException extends RuntimeException {

    public WorkflowStateSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
