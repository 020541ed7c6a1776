package uk.gegc.planconfigurator.features.backend.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.planconfigurator.features.backend.application.RequestLifecycleListener;
import uk.gegc.planconfigurator.features.backend.domain.model.RequestCompletedEvent;
import uk.gegc.planconfigurator.features.backend.domain.model.RequestStartedEvent;

/**
 * Emits Micrometer metrics for backend calls, tagged by operation.
 */
@Slf4j
@Component
public class BackendMetricsListener implements RequestLifecycleListener {

    private final MeterRegistry meterRegistry;

    public BackendMetricsListener(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void onRequestStarted(RequestStartedEvent event) {
        Counter.builder("backend.requests")
                .description("Number of backend request attempts")
                .tag("operation", event.operation())
                .tag("method", event.method().name())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void onRequestCompleted(RequestCompletedEvent event) {
        Timer.builder("backend.latency")
                .description("Latency of backend request attempts")
                .tag("operation", event.operation())
                .tag("outcome", event.successful() ? "success" : event.error().kind().name().toLowerCase())
                .register(meterRegistry)
                .record(event.elapsed());

        if (event.willRetry()) {
            Counter.builder("backend.retries")
                    .description("Number of backend request retries")
                    .tag("operation", event.operation())
                    .register(meterRegistry)
                    .increment();
        } else if (!event.successful()) {
            Counter.builder("backend.failures")
                    .description("Number of failed backend calls")
                    .tag("operation", event.operation())
                    .tag("kind", event.error().kind().name())
                    .register(meterRegistry)
                    .increment();
        }
        log.debug("Recorded backend attempt metrics: operation={}, attempt={}, status={}",
                event.operation(), event.attempt(), event.status());
    }

    @Override
    public void onRequestSuperseded(String operation, String slotKey) {
        Counter.builder("backend.superseded")
                .description("Number of backend results discarded by the race guard")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }
}
