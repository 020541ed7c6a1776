package uk.gegc.planconfigurator.features.backend.domain.exception;

import uk.gegc.planconfigurator.features.backend.domain.model.ErrorEnvelope;
import uk.gegc.planconfigurator.features.backend.domain.model.ErrorKind;

public class AuthenticationRequiredException extends BackendCallException {

    public AuthenticationRequiredException(String operation) {
        super(operation, ErrorEnvelope.of(ErrorKind.UNAUTHENTICATED,
                "Operation '" + operation + "' requires an auth token"));
    }
}
