package uk.gegc.planconfigurator.features.backend.domain.exception;

/**
 * Thrown when a parameter required by an endpoint is absent. Indicates a programming error
 * in the caller; never retried.
 */
public class MissingParameterException extends RuntimeException {

    private final String operation;
    private final String parameter;

    public MissingParameterException(String operation, String parameter) {
        super("Operation '" + operation + "' requires parameter '" + parameter + "'");
        this.operation = operation;
        this.parameter = parameter;
    }

    public String getOperation() {
        return operation;
    }

    public String getParameter() {
        return parameter;
    }
}
