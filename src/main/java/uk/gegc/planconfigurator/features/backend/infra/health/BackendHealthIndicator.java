package uk.gegc.planconfigurator.features.backend.infra.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import uk.gegc.planconfigurator.features.backend.application.BackendClient;
import uk.gegc.planconfigurator.features.backend.domain.exception.BackendCallException;
import uk.gegc.planconfigurator.features.backend.domain.model.OperationParams;
import uk.gegc.planconfigurator.features.backend.domain.model.ResponseEnvelope;
import uk.gegc.planconfigurator.features.backend.infra.config.BackendEndpointCatalog;
import uk.gegc.planconfigurator.shared.util.FutureUtils;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Health indicator that reports billing backend availability through its public status endpoint.
 */
@Component
@ConditionalOnProperty(name = "backend.health.enabled", havingValue = "true", matchIfMissing = true)
public class BackendHealthIndicator implements HealthIndicator {

    private static final long HEALTH_TIMEOUT_SECONDS = 5;

    private final BackendClient backendClient;

    public BackendHealthIndicator(BackendClient backendClient) {
        this.backendClient = backendClient;
    }

    @Override
    public Health health() {
        try {
            CompletableFuture<ResponseEnvelope> call = backendClient
                    .call(BackendEndpointCatalog.SERVICE_STATUS, OperationParams.none(), null)
                    .orTimeout(HEALTH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            ResponseEnvelope response = FutureUtils.join(call);

            Health.Builder builder = Health.up()
                    .withDetail("status", String.valueOf(response.data().get("status")));
            if (response.data().get("version") != null) {
                builder.withDetail("version", response.data().get("version"));
            }
            return builder.build();
        } catch (BackendCallException ex) {
            Health.Builder builder = Health.down(ex)
                    .withDetail("kind", ex.getError().kind().name());
            if (ex.getError().status() != null) {
                builder.withDetail("statusCode", ex.getError().status());
            }
            return builder.build();
        } catch (Exception ex) {
            return Health.down(ex).build();
        }
    }
}
