package uk.gegc.planconfigurator.features.workflow.domain.exception;

/**
 * The requested action does not apply to the session's current position, e.g. submitting
 * a plan before the workflow is completed.
 */
public class WorkflowStateConflictException extends RuntimeException {

    public WorkflowStateConflictException(String message) {
        super(message);
    }
}
