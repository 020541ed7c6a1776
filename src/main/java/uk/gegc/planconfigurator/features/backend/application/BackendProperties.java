package uk.gegc.planconfigurator.features.backend.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Billing backend connection, timeout and retry settings.
 */
@Configuration
@ConfigurationProperties(prefix = "backend")
@Validated
@Data
public class BackendProperties {

    /**
     * Base URL every endpoint path is resolved against, e.g. https://billing.example.com/api.
     */
    @NotBlank
    private String baseUrl = "http://localhost:8081";

    @Positive
    private int connectTimeoutMs = 2000;

    /**
     * Per-attempt timeout. Each retry gets a fresh budget.
     */
    @Positive
    private int readTimeoutMs = 10000;

    /**
     * Token used for calls made on behalf of the application itself (catalog sync, health).
     * Blank means those calls go out unauthenticated.
     */
    private String serviceToken;

    @Valid
    private Retry retry = new Retry();

    @Data
    public static class Retry {

        /**
         * Retries after the first attempt; applies to idempotent requests only.
         */
        @PositiveOrZero
        private int maxRetries = 3;

        @Positive
        private long baseDelayMs = 200;

        @DecimalMin("1.0")
        private double multiplier = 2.0d;

        @Positive
        private long maxDelayMs = 2000;

        /**
         * 0.0 = no jitter, 0.2 = ±20% variation.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitterFactor = 0.2d;
    }
}
