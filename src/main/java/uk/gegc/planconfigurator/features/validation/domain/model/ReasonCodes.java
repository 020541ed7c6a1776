package uk.gegc.planconfigurator.features.validation.domain.model;

/**
 * Reason codes carried by invalid {@link ValidationResult}s. The presentation layer maps
 * them to localized messages.
 */
public final class ReasonCodes {

    public static final String REQUIRED = "REQUIRED";
    public static final String INVALID_TYPE = "INVALID_TYPE";
    public static final String TOO_LONG = "TOO_LONG";
    public static final String PATTERN_MISMATCH = "PATTERN_MISMATCH";
    public static final String OUT_OF_RANGE = "OUT_OF_RANGE";
    public static final String NOT_ALLOWED = "NOT_ALLOWED";
    public static final String NOT_UNIQUE = "NOT_UNIQUE";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String BACKEND_UNAVAILABLE = "BACKEND_UNAVAILABLE";
    public static final String PENDING = "PENDING";

    private ReasonCodes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
