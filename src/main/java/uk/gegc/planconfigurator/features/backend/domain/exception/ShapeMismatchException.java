package uk.gegc.planconfigurator.features.backend.domain.exception;

/**
 * Thrown when a payload does not match the mapping table of its operation. Signals backend
 * contract drift, which operators must be able to tell apart from an unreachable backend.
 */
public class ShapeMismatchException extends RuntimeException {

    private final String operation;
    private final String fieldPath;

    public ShapeMismatchException(String operation, String fieldPath, String reason) {
        super(String.format("Shape mismatch for operation '%s' at '%s': %s", operation, fieldPath, reason));
        this.operation = operation;
        this.fieldPath = fieldPath;
    }

    public String getOperation() {
        return operation;
    }

    public String getFieldPath() {
        return fieldPath;
    }
}
