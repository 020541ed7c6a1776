package uk.gegc.planconfigurator.features.workflow.application;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Session retention for in-memory and persisted workflow state.
 */
@Configuration
@ConfigurationProperties(prefix = "workflow")
@Validated
@Data
public class WorkflowProperties {

    /**
     * Idle time after which a session is dropped.
     */
    @NotNull
    private Duration stateTtl = Duration.ofHours(24);

    @Positive
    private long maxSessions = 10_000L;
}
