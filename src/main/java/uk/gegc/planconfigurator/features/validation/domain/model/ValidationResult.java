package uk.gegc.planconfigurator.features.validation.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of validating one field. Invalid results are user-correctable and are returned,
 * never thrown.
 */
public record ValidationResult(Status status, String reasonCode, String message) {

    private static final ValidationResult VALID = new ValidationResult(Status.VALID, null, null);

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(String reasonCode, String message) {
        return new ValidationResult(Status.INVALID, reasonCode, message);
    }

    /**
     * A server check whose answer was superseded or has not arrived yet.
     */
    public static ValidationResult pending(String message) {
        return new ValidationResult(Status.PENDING, ReasonCodes.PENDING, message);
    }

    @JsonIgnore
    public boolean isValid() {
        return status == Status.VALID;
    }

    @JsonIgnore
    public boolean isInvalid() {
        return status == Status.INVALID;
    }

    public enum Status {
        VALID,
        INVALID,
        PENDING
    }
}
