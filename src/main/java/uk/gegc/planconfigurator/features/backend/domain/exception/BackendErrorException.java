package uk.gegc.planconfigurator.features.backend.domain.exception;

import uk.gegc.planconfigurator.features.backend.domain.model.ErrorEnvelope;

/**
 * Backend answered with an error status in a recognised shape.
 */
public class BackendErrorException extends BackendCallException {

    public BackendErrorException(String operation, ErrorEnvelope error) {
        super(operation, error);
    }

    public int getStatus() {
        return getError().status() != null ? getError().status() : 0;
    }
}
