package uk.gegc.planconfigurator.features.backend.application.error;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Recognises one error payload layout used by the backend. Supporting a new layout means
 * adding an implementation; the normalizer tries them in {@link org.springframework.core.annotation.Order} order.
 */
public interface ErrorShapeExtractor {

    Optional<ExtractedError> extract(JsonNode payload);
}
