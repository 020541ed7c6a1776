package uk.gegc.planconfigurator.features.validation.application.checks;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.planconfigurator.features.backend.domain.exception.BackendCallException;
import uk.gegc.planconfigurator.features.backend.domain.exception.BackendErrorException;
import uk.gegc.planconfigurator.features.backend.domain.exception.ShapeMismatchException;
import uk.gegc.planconfigurator.features.backend.domain.exception.SupersededRequestException;
import uk.gegc.planconfigurator.features.backend.domain.model.ResponseEnvelope;
import uk.gegc.planconfigurator.features.validation.domain.model.ReasonCodes;
import uk.gegc.planconfigurator.features.validation.domain.model.ServerCheck;
import uk.gegc.planconfigurator.features.validation.domain.model.ValidationResult;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepContext;
import uk.gegc.planconfigurator.shared.util.FutureUtils;

import java.util.concurrent.CompletableFuture;

/**
 * Base for server checks backed by one backend call. Maps call failures onto validation
 * results so a failing backend blocks the field instead of failing the step.
 */
@Slf4j
public abstract class BackendServerCheck implements ServerCheck {

    @Override
    public CompletableFuture<ValidationResult> check(Object value, StepContext context, String authToken) {
        return call(value, context, authToken).handle((response, error) -> error == null
                ? interpret(value, response)
                : onFailure(FutureUtils.unwrap(error)));
    }

    protected abstract CompletableFuture<ResponseEnvelope> call(Object value, StepContext context, String authToken);

    protected abstract ValidationResult interpret(Object value, ResponseEnvelope response);

    /**
     * Race guard scope for this check within the context's session, {@code null} outside one.
     * A re-run in the same session overtakes an older run still waiting for the backend;
     * other sessions are unaffected.
     */
    protected String slotScope(StepContext context) {
        return context.sessionId() != null ? "session:" + context.sessionId() + " check:" + name() : null;
    }

    /**
     * Result for a 404 from the backend; by default the backend is treated as unavailable.
     */
    protected ValidationResult onNotFound(BackendErrorException error) {
        return unavailable();
    }

    private ValidationResult onFailure(Throwable error) {
        if (error instanceof SupersededRequestException) {
            return ValidationResult.pending("A newer check for this value is in progress");
        }
        if (error instanceof BackendErrorException backendError && backendError.getStatus() == 404) {
            return onNotFound(backendError);
        }
        if (error instanceof BackendCallException backendError) {
            log.warn("Server check '{}' could not reach the backend: kind={}, message={}",
                    name(), backendError.getError().kind(), backendError.getMessage());
            return unavailable();
        }
        if (error instanceof ShapeMismatchException mismatch) {
            log.error("Server check '{}' received an unexpected response shape at '{}'", name(), mismatch.getFieldPath());
            return unavailable();
        }
        log.error("Server check '{}' failed unexpectedly", name(), error);
        return unavailable();
    }

    private static ValidationResult unavailable() {
        return ValidationResult.invalid(ReasonCodes.BACKEND_UNAVAILABLE,
                "Could not be verified right now, please try again");
    }
}
