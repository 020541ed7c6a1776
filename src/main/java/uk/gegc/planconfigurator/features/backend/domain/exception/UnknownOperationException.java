package uk.gegc.planconfigurator.features.backend.domain.exception;

/**
 * Thrown when an operation name has no endpoint definition. Indicates a configuration bug;
 * never retried.
 */
public class UnknownOperationException extends RuntimeException {

    private final String operation;

    public UnknownOperationException(String operation) {
        super("Unknown backend operation: " + operation);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
