package uk.gegc.planconfigurator.features.backend.application;

import uk.gegc.planconfigurator.features.backend.domain.model.ExecutionOptions;
import uk.gegc.planconfigurator.features.backend.domain.model.RequestDescriptor;
import uk.gegc.planconfigurator.features.backend.domain.model.ResponseEnvelope;

import java.util.concurrent.CompletableFuture;

/**
 * Performs a resolved request against the backend.
 * <p>
 * The returned future completes with a {@link ResponseEnvelope} on a 2xx response, or
 * exceptionally with a {@link uk.gegc.planconfigurator.features.backend.domain.exception.BackendCallException}
 * subtype. Exactly one outcome per call; never both.
 */
public interface RequestExecutor {

    CompletableFuture<ResponseEnvelope> execute(RequestDescriptor descriptor, ExecutionOptions options);
}
