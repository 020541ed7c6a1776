package uk.gegc.planconfigurator.features.backend.domain.exception;

import uk.gegc.planconfigurator.features.backend.domain.model.ErrorEnvelope;
import uk.gegc.planconfigurator.features.backend.domain.model.ErrorKind;

/**
 * No usable response from the backend: transport failure or timeout, after retries were exhausted.
 */
public class NetworkException extends BackendCallException {

    private final int attempts;

    public NetworkException(String operation, ErrorEnvelope error, int attempts, Throwable cause) {
        super(operation, error, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isTimeout() {
        return getError().kind() == ErrorKind.TIMEOUT;
    }
}
