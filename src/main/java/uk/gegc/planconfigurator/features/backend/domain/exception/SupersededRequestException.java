package uk.gegc.planconfigurator.features.backend.domain.exception;

import uk.gegc.planconfigurator.features.backend.domain.model.ErrorEnvelope;
import uk.gegc.planconfigurator.features.backend.domain.model.ErrorKind;

/**
 * The result of this call was discarded because a newer call for the same slot was issued.
 */
public class SupersededRequestException extends BackendCallException {

    private final String slot;

    public SupersededRequestException(String operation, String slot) {
        super(operation, ErrorEnvelope.of(ErrorKind.SUPERSEDED,
                "Request for slot '" + slot + "' was superseded by a newer request"));
        this.slot = slot;
    }

    public String getSlot() {
        return slot;
    }
}
