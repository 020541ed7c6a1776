package uk.gegc.planconfigurator.features.backend.domain.model;

import org.springframework.http.HttpMethod;

import java.time.Duration;

/**
 * Outcome of one attempt. {@code error} is {@code null} for successful attempts.
 */
public record RequestCompletedEvent(
        String operation,
        HttpMethod method,
        String slotKey,
        int attempt,
        Integer status,
        Duration elapsed,
        ErrorEnvelope error,
        boolean willRetry
) {

    public boolean successful() {
        return error == null;
    }
}
