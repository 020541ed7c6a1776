package uk.gegc.planconfigurator.features.validation.application.checks;

import org.springframework.stereotype.Component;
import uk.gegc.planconfigurator.features.backend.application.BackendClient;
import uk.gegc.planconfigurator.features.backend.domain.exception.BackendErrorException;
import uk.gegc.planconfigurator.features.backend.domain.model.OperationParams;
import uk.gegc.planconfigurator.features.backend.domain.model.ResponseEnvelope;
import uk.gegc.planconfigurator.features.backend.infra.config.BackendEndpointCatalog;
import uk.gegc.planconfigurator.features.validation.domain.model.ReasonCodes;
import uk.gegc.planconfigurator.features.validation.domain.model.ValidationResult;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepContext;

import java.util.concurrent.CompletableFuture;

/**
 * The selected account must exist and be open for new plans.
 */
@Component
public class AccountExistsCheck extends BackendServerCheck {

    private static final String CLOSED = "closed";

    private final BackendClient backendClient;

    public AccountExistsCheck(BackendClient backendClient) {
        this.backendClient = backendClient;
    }

    @Override
    public String name() {
        return "account-exists";
    }

    @Override
    protected CompletableFuture<ResponseEnvelope> call(Object value, StepContext context, String authToken) {
        return backendClient.callLatest(slotScope(context), BackendEndpointCatalog.ACCOUNT,
                OperationParams.ofId(String.valueOf(value)), authToken);
    }

    @Override
    protected ValidationResult interpret(Object value, ResponseEnvelope response) {
        if (CLOSED.equalsIgnoreCase(String.valueOf(response.data().get("status")))) {
            return ValidationResult.invalid(ReasonCodes.NOT_ALLOWED, "Account " + value + " is closed");
        }
        return ValidationResult.valid();
    }

    @Override
    protected ValidationResult onNotFound(BackendErrorException error) {
        return ValidationResult.invalid(ReasonCodes.NOT_FOUND, "Account not found");
    }
}
