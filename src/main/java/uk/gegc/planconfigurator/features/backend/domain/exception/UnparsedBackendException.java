package uk.gegc.planconfigurator.features.backend.domain.exception;

import uk.gegc.planconfigurator.features.backend.domain.model.ErrorEnvelope;

/**
 * Backend answered with an error in a shape no extractor recognises. The raw payload is
 * kept on the envelope.
 */
public class UnparsedBackendException extends BackendCallException {

    public UnparsedBackendException(String operation, ErrorEnvelope error) {
        super(operation, error);
    }
}
