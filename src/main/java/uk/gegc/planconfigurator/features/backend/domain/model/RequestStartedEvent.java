package uk.gegc.planconfigurator.features.backend.domain.model;

import org.springframework.http.HttpMethod;

import java.time.Instant;

public record RequestStartedEvent(
        String operation,
        HttpMethod method,
        String uri,
        String slotKey,
        int attempt,
        Instant startedAt
) {
}
