package uk.gegc.planconfigurator.features.backend.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Successful backend response.
 *
 * @param status HTTP status code
 * @param data   canonical shape produced by the data transformer; {@code null} until transformed
 *               or when the operation has no response mapping
 * @param raw    backend payload as received, kept for diagnostics
 */
public record ResponseEnvelope(int status, Map<String, Object> data, JsonNode raw) {

    public static ResponseEnvelope of(int status, JsonNode raw) {
        return new ResponseEnvelope(status, null, raw);
    }

    public ResponseEnvelope withData(Map<String, Object> canonical) {
        return new ResponseEnvelope(status, canonical, raw);
    }
}
