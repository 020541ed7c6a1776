package uk.gegc.planconfigurator.features.backend.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalized error, independent of how the backend nested its error payload.
 *
 * @param kind          error category
 * @param message       human readable summary
 * @param backendDetail extra detail extracted from the backend payload, if any
 * @param status        HTTP status when a response was received
 * @param raw           backend payload as received, attached for diagnosis
 */
public record ErrorEnvelope(
        ErrorKind kind,
        String message,
        String backendDetail,
        Integer status,
        JsonNode raw
) {

    public static ErrorEnvelope of(ErrorKind kind, String message) {
        return new ErrorEnvelope(kind, message, null, null, null);
    }

    public boolean transientFailure() {
        return kind == ErrorKind.NETWORK || kind == ErrorKind.TIMEOUT;
    }
}
