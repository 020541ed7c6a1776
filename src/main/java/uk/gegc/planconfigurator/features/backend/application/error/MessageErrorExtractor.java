package uk.gegc.planconfigurator.features.backend.application.error;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * {@code {"message": "..."}}, optionally with a {@code code}.
 */
@Component
@Order(20)
public class MessageErrorExtractor implements ErrorShapeExtractor {

    @Override
    public Optional<ExtractedError> extract(JsonNode payload) {
        JsonNode message = payload.path("message");
        if (!message.isTextual() || message.asText().isBlank()) {
            return Optional.empty();
        }
        JsonNode code = payload.path("code");
        String detail = code.isValueNode() && !code.isNull() ? code.asText() : null;
        return Optional.of(new ExtractedError(message.asText(), detail));
    }
}
