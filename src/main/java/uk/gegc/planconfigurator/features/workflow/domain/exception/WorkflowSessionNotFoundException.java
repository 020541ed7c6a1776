package uk.gegc.planconfigurator.features.workflow.domain.exception;

public class WorkflowSessionNotFoundException extends RuntimeException {

    public WorkflowSessionNotFoundException(String sessionId) {
        super("Workflow session " + sessionId + " not found");
    }
}
