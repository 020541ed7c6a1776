package uk.gegc.planconfigurator.features.backend.domain.exception;

import uk.gegc.planconfigurator.features.backend.domain.model.ErrorEnvelope;

/**
 * Base type for failures of a backend call. Always carries a normalized {@link ErrorEnvelope}.
 */
public class BackendCallException extends RuntimeException {

    private final String operation;
    private final transient ErrorEnvelope error;

    public BackendCallException(String operation, ErrorEnvelope error) {
        super(error.message());
        this.operation = operation;
        this.error = error;
    }

    public BackendCallException(String operation, ErrorEnvelope error, Throwable cause) {
        super(error.message(), cause);
        this.operation = operation;
        this.error = error;
    }

    public String getOperation() {
        return operation;
    }

    public ErrorEnvelope getError() {
        return error;
    }
}
