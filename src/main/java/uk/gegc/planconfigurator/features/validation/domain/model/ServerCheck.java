package uk.gegc.planconfigurator.features.validation.domain.model;

import uk.gegc.planconfigurator.features.workflow.domain.model.StepContext;

import java.util.concurrent.CompletableFuture;

/**
 * Validation that needs a backend round trip, e.g. a uniqueness check. Runs only after
 * every local rule of the step passed.
 * <p>
 * Implementations report backend failures as results; the returned future should not fail.
 */
public interface ServerCheck {

    String name();

    CompletableFuture<ValidationResult> check(Object value, StepContext context, String authToken);
}
