package uk.gegc.planconfigurator.features.backend.application.error;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code {"errors": [{"message": "..."}, ...]}}. The first message becomes the summary,
 * all of them the detail.
 */
@Component
@Order(30)
public class ErrorListExtractor implements ErrorShapeExtractor {

    @Override
    public Optional<ExtractedError> extract(JsonNode payload) {
        JsonNode errors = payload.path("errors");
        if (!errors.isArray()) {
            return Optional.empty();
        }
        List<String> messages = new ArrayList<>();
        for (JsonNode error : errors) {
            JsonNode message = error.path("message");
            if (message.isTextual() && !message.asText().isBlank()) {
                messages.add(message.asText());
            }
        }
        if (messages.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ExtractedError(messages.get(0), String.join("; ", messages)));
    }
}
