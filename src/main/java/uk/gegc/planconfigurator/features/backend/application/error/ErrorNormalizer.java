package uk.gegc.planconfigurator.features.backend.application.error;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.planconfigurator.features.backend.domain.exception.BackendCallException;
import uk.gegc.planconfigurator.features.backend.domain.exception.BackendErrorException;
import uk.gegc.planconfigurator.features.backend.domain.exception.UnparsedBackendException;
import uk.gegc.planconfigurator.features.backend.domain.model.ErrorEnvelope;
import uk.gegc.planconfigurator.features.backend.domain.model.ErrorKind;

import java.util.List;
import java.util.Optional;

/**
 * Turns an error response into a single {@link ErrorEnvelope}, whichever layout the backend used.
 */
@Slf4j
@Component
public class ErrorNormalizer {

    private final List<ErrorShapeExtractor> extractors;

    public ErrorNormalizer(List<ErrorShapeExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
    }

    public BackendCallException normalize(String operation, int status, JsonNode payload) {
        if (payload != null && payload.isObject()) {
            for (ErrorShapeExtractor extractor : extractors) {
                Optional<ExtractedError> extracted = extractor.extract(payload);
                if (extracted.isPresent()) {
                    ExtractedError error = extracted.get();
                    return new BackendErrorException(operation,
                            new ErrorEnvelope(ErrorKind.BACKEND, error.message(), error.detail(), status, payload));
                }
            }
        }
        log.warn("Unrecognised error payload from backend: operation={}, status={}", operation, status);
        return new UnparsedBackendException(operation, new ErrorEnvelope(ErrorKind.UNPARSED_BACKEND,
                "Backend returned HTTP " + status + " with an unrecognised error payload", null, status, payload));
    }
}
