package uk.gegc.planconfigurator.features.validation.application.checks;

import org.springframework.stereotype.Component;
import uk.gegc.planconfigurator.features.backend.application.BackendClient;
import uk.gegc.planconfigurator.features.backend.domain.model.OperationParams;
import uk.gegc.planconfigurator.features.backend.domain.model.ResponseEnvelope;
import uk.gegc.planconfigurator.features.backend.infra.config.BackendEndpointCatalog;
import uk.gegc.planconfigurator.features.validation.domain.model.ReasonCodes;
import uk.gegc.planconfigurator.features.validation.domain.model.ValidationResult;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepContext;

import java.util.concurrent.CompletableFuture;

/**
 * Plan names must be unique per account.
 */
@Component
public class PlanNameUniquenessCheck extends BackendServerCheck {

    static final String ACCOUNT_FIELD_ID = "accountId";

    private final BackendClient backendClient;

    public PlanNameUniquenessCheck(BackendClient backendClient) {
        this.backendClient = backendClient;
    }

    @Override
    public String name() {
        return "plan-name-unique";
    }

    @Override
    protected CompletableFuture<ResponseEnvelope> call(Object value, StepContext context, String authToken) {
        OperationParams.OperationParamsBuilder params = OperationParams.builder()
                .filter("name", String.valueOf(value).trim());
        if (context.has(ACCOUNT_FIELD_ID)) {
            params.filter("account_id", String.valueOf(context.value(ACCOUNT_FIELD_ID)));
        }
        return backendClient.callLatest(slotScope(context), BackendEndpointCatalog.PLAN_NAME_AVAILABILITY,
                params.build(), authToken);
    }

    @Override
    protected ValidationResult interpret(Object value, ResponseEnvelope response) {
        if (Boolean.TRUE.equals(response.data().get("available"))) {
            return ValidationResult.valid();
        }
        Object suggestion = response.data().get("suggestion");
        String message = suggestion != null
                ? "A plan with this name already exists, try \"" + suggestion + "\""
                : "A plan with this name already exists";
        return ValidationResult.invalid(ReasonCodes.NOT_UNIQUE, message);
    }
}
