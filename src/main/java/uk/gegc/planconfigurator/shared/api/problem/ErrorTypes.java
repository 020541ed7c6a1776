package uk.gegc.planconfigurator.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://plans.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI WORKFLOW_SESSION_NOT_FOUND = URI.create(BASE_URL + "/workflow-session-not-found");
    public static final URI UNKNOWN_STEP = URI.create(BASE_URL + "/unknown-step");
    public static final URI UNKNOWN_FIELD = URI.create(BASE_URL + "/unknown-field");
    public static final URI WORKFLOW_STATE_CONFLICT = URI.create(BASE_URL + "/workflow-state-conflict");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Backend Errors ====================
    public static final URI BACKEND_UNAVAILABLE = URI.create(BASE_URL + "/backend-unavailable");
    public static final URI BACKEND_TIMEOUT = URI.create(BASE_URL + "/backend-timeout");
    public static final URI BACKEND_ERROR = URI.create(BASE_URL + "/backend-error");
    public static final URI UNPARSED_BACKEND_ERROR = URI.create(BASE_URL + "/unparsed-backend-error");
    public static final URI SHAPE_MISMATCH = URI.create(BASE_URL + "/shape-mismatch");
    public static final URI REQUEST_SUPERSEDED = URI.create(BASE_URL + "/request-superseded");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");

    // ==================== System Errors ====================
    public static final URI CONFIGURATION_ERROR = URI.create(BASE_URL + "/configuration-error");
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
