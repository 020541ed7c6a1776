package uk.gegc.planconfigurator.features.backend.application.error;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * {@code {"error": {"details": "...", "message": "..."}}}
 */
@Component
@Order(10)
public class NestedDetailsErrorExtractor implements ErrorShapeExtractor {

    @Override
    public Optional<ExtractedError> extract(JsonNode payload) {
        JsonNode error = payload.path("error");
        if (!error.isObject()) {
            return Optional.empty();
        }
        JsonNode details = error.path("details");
        if (!details.isTextual() || details.asText().isBlank()) {
            return Optional.empty();
        }
        JsonNode message = error.path("message");
        String summary = message.isTextual() && !message.asText().isBlank() ? message.asText() : details.asText();
        return Optional.of(new ExtractedError(summary, details.asText()));
    }
}
