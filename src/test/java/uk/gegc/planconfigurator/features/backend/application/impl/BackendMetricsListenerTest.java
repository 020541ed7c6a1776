package uk.gegc.planconfigurator.features.backend.application.impl;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import uk.gegc.planconfigurator.features.backend.domain.model.ErrorEnvelope;
import uk.gegc.planconfigurator.features.backend.domain.model.ErrorKind;
import uk.gegc.planconfigurator.features.backend.domain.model.RequestCompletedEvent;
import uk.gegc.planconfigurator.features.backend.domain.model.RequestStartedEvent;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BackendMetricsListener")
class BackendMetricsListenerTest {

    private SimpleMeterRegistry meterRegistry;
    private BackendMetricsListener listener;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        listener = new BackendMetricsListener(meterRegistry);
    }

    @Test
    @DisplayName("counts every attempt by operation and method")
    void countsAttempts() {
        listener.onRequestStarted(new RequestStartedEvent("plan", HttpMethod.GET, "http://b/v1/plans/1", "slot", 1, Instant.now()));
        listener.onRequestStarted(new RequestStartedEvent("plan", HttpMethod.GET, "http://b/v1/plans/1", "slot", 2, Instant.now()));

        assertThat(meterRegistry.get("backend.requests").tag("operation", "plan").tag("method", "GET").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("a retried attempt counts as a retry, the final failure as a failure")
    void retriesAndFailures() {
        ErrorEnvelope timeout = ErrorEnvelope.of(ErrorKind.TIMEOUT, "slow");
        listener.onRequestCompleted(new RequestCompletedEvent("plan", HttpMethod.GET, "slot", 1, null,
                Duration.ofMillis(300), timeout, true));
        listener.onRequestCompleted(new RequestCompletedEvent("plan", HttpMethod.GET, "slot", 2, null,
                Duration.ofMillis(300), timeout, false));

        assertThat(meterRegistry.get("backend.retries").tag("operation", "plan").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("backend.failures").tag("kind", "TIMEOUT").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("backend.latency").tag("outcome", "timeout").timer().count()).isEqualTo(2);
    }

    @Test
    @DisplayName("successful attempts record latency only")
    void success() {
        listener.onRequestCompleted(new RequestCompletedEvent("plan", HttpMethod.GET, "slot", 1, 200,
                Duration.ofMillis(40), null, false));

        assertThat(meterRegistry.get("backend.latency").tag("outcome", "success").timer().count()).isEqualTo(1);
        assertThat(meterRegistry.find("backend.failures").counter()).isNull();
        assertThat(meterRegistry.find("backend.retries").counter()).isNull();
    }

    @Test
    @DisplayName("counts superseded results")
    void superseded() {
        listener.onRequestSuperseded("plan-name-availability", "slot");

        assertThat(meterRegistry.get("backend.superseded").tag("operation", "plan-name-availability").counter().count())
                .isEqualTo(1.0);
    }
}
