package uk.gegc.planconfigurator.features.validation.application.checks;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.planconfigurator.features.backend.application.BackendClient;
import uk.gegc.planconfigurator.features.backend.domain.exception.BackendErrorException;
import uk.gegc.planconfigurator.features.backend.domain.exception.NetworkException;
import uk.gegc.planconfigurator.features.backend.domain.exception.SupersededRequestException;
import uk.gegc.planconfigurator.features.backend.domain.model.ErrorEnvelope;
import uk.gegc.planconfigurator.features.backend.domain.model.ErrorKind;
import uk.gegc.planconfigurator.features.backend.domain.model.OperationParams;
import uk.gegc.planconfigurator.features.backend.domain.model.ResponseEnvelope;
import uk.gegc.planconfigurator.features.backend.infra.config.BackendEndpointCatalog;
import uk.gegc.planconfigurator.features.validation.domain.model.ReasonCodes;
import uk.gegc.planconfigurator.features.validation.domain.model.ValidationResult;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepContext;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Backend server checks")
class BackendServerCheckTest {

    @Mock
    private BackendClient backendClient;

    private static CompletableFuture<ResponseEnvelope> ok(Map<String, Object> data) {
        return CompletableFuture.completedFuture(new ResponseEnvelope(200, data, null));
    }

    private static <T> CompletableFuture<T> failed(Throwable error) {
        return CompletableFuture.failedFuture(error);
    }

    @Nested
    @DisplayName("PlanNameUniquenessCheck")
    class PlanNameUniqueness {

        private PlanNameUniquenessCheck check;

        @BeforeEach
        void setUp() {
            check = new PlanNameUniquenessCheck(backendClient);
        }

        @Test
        @DisplayName("available name is valid and filters by account")
        void available() {
            when(backendClient.callLatest(any(), eq(BackendEndpointCatalog.PLAN_NAME_AVAILABILITY), any(OperationParams.class), eq("tok")))
                    .thenReturn(ok(Map.of("available", true)));
            StepContext context = new StepContext(null, Map.of("accountId", "acc_1234"));

            ValidationResult result = check.check("  Team plan ", context, "tok").join();

            assertThat(result.isValid()).isTrue();
            ArgumentCaptor<OperationParams> params = ArgumentCaptor.forClass(OperationParams.class);
            verify(backendClient).callLatest(any(), eq(BackendEndpointCatalog.PLAN_NAME_AVAILABILITY), params.capture(), eq("tok"));
            assertThat(params.getValue().filters())
                    .containsEntry("name", "Team plan")
                    .containsEntry("account_id", "acc_1234");
        }

        @Test
        @DisplayName("calls are race guarded per session, not across sessions")
        void scopedToSession() {
            when(backendClient.callLatest(any(), eq(BackendEndpointCatalog.PLAN_NAME_AVAILABILITY), any(OperationParams.class), any()))
                    .thenReturn(ok(Map.of("available", true)));

            check.check("Team plan", new StepContext("s-1", null, Map.of()), "tok").join();
            check.check("Team plan", new StepContext("s-2", null, Map.of()), "tok").join();
            check.check("Team plan", new StepContext(null, Map.of()), "tok").join();

            ArgumentCaptor<String> scopes = ArgumentCaptor.forClass(String.class);
            verify(backendClient, times(3)).callLatest(scopes.capture(),
                    eq(BackendEndpointCatalog.PLAN_NAME_AVAILABILITY), any(OperationParams.class), eq("tok"));
            assertThat(scopes.getAllValues()).containsExactly(
                    "session:s-1 check:plan-name-unique", "session:s-2 check:plan-name-unique", null);
        }

        @Test
        @DisplayName("taken name is NOT_UNIQUE with the backend's suggestion")
        void taken() {
            when(backendClient.callLatest(any(), eq(BackendEndpointCatalog.PLAN_NAME_AVAILABILITY), any(OperationParams.class), any()))
                    .thenReturn(ok(Map.of("available", false, "suggestion", "Team plan 2")));

            ValidationResult result = check.check("Team plan", new StepContext(null, Map.of()), "tok").join();

            assertThat(result.reasonCode()).isEqualTo(ReasonCodes.NOT_UNIQUE);
            assertThat(result.message()).contains("Team plan 2");
        }

        @Test
        @DisplayName("superseded call reports the field as pending")
        void superseded() {
            when(backendClient.callLatest(any(), eq(BackendEndpointCatalog.PLAN_NAME_AVAILABILITY), any(OperationParams.class), any()))
                    .thenReturn(failed(new SupersededRequestException(BackendEndpointCatalog.PLAN_NAME_AVAILABILITY, "slot")));

            ValidationResult result = check.check("Team plan", new StepContext(null, Map.of()), "tok").join();

            assertThat(result.status()).isEqualTo(ValidationResult.Status.PENDING);
        }

        @Test
        @DisplayName("unreachable backend blocks the field instead of failing")
        void unreachable() {
            when(backendClient.callLatest(any(), eq(BackendEndpointCatalog.PLAN_NAME_AVAILABILITY), any(OperationParams.class), any()))
                    .thenReturn(failed(new NetworkException(BackendEndpointCatalog.PLAN_NAME_AVAILABILITY,
                            ErrorEnvelope.of(ErrorKind.TIMEOUT, "timed out"), 3, null)));

            ValidationResult result = check.check("Team plan", new StepContext(null, Map.of()), "tok").join();

            assertThat(result.reasonCode()).isEqualTo(ReasonCodes.BACKEND_UNAVAILABLE);
        }
    }

    @Nested
    @DisplayName("AccountExistsCheck")
    class AccountExists {

        private AccountExistsCheck check;

        @BeforeEach
        void setUp() {
            check = new AccountExistsCheck(backendClient);
        }

        @Test
        @DisplayName("open account is valid")
        void open() {
            when(backendClient.callLatest(any(), eq(BackendEndpointCatalog.ACCOUNT), eq(OperationParams.ofId("acc_1234")), any()))
                    .thenReturn(ok(Map.of("id", "acc_1234", "status", "active")));

            assertThat(check.check("acc_1234", new StepContext(null, Map.of()), "tok").join().isValid()).isTrue();
        }

        @Test
        @DisplayName("closed account is NOT_ALLOWED")
        void closed() {
            when(backendClient.callLatest(any(), eq(BackendEndpointCatalog.ACCOUNT), any(OperationParams.class), any()))
                    .thenReturn(ok(Map.of("id", "acc_1234", "status", "CLOSED")));

            ValidationResult result = check.check("acc_1234", new StepContext(null, Map.of()), "tok").join();

            assertThat(result.reasonCode()).isEqualTo(ReasonCodes.NOT_ALLOWED);
        }

        @Test
        @DisplayName("404 from the backend is NOT_FOUND")
        void missing() {
            ErrorEnvelope notFound = new ErrorEnvelope(ErrorKind.BACKEND, "Account not found", null, 404, null);
            when(backendClient.callLatest(any(), eq(BackendEndpointCatalog.ACCOUNT), any(OperationParams.class), any()))
                    .thenReturn(failed(new BackendErrorException(BackendEndpointCatalog.ACCOUNT, notFound)));

            ValidationResult result = check.check("acc_9999", new StepContext(null, Map.of()), "tok").join();

            assertThat(result.reasonCode()).isEqualTo(ReasonCodes.NOT_FOUND);
        }

        @Test
        @DisplayName("other backend errors leave the account unverified")
        void serverError() {
            ErrorEnvelope boom = new ErrorEnvelope(ErrorKind.BACKEND, "Internal error", null, 500, null);
            when(backendClient.callLatest(any(), eq(BackendEndpointCatalog.ACCOUNT), any(OperationParams.class), any()))
                    .thenReturn(failed(new BackendErrorException(BackendEndpointCatalog.ACCOUNT, boom)));

            ValidationResult result = check.check("acc_9999", new StepContext(null, Map.of()), "tok").join();

            assertThat(result.reasonCode()).isEqualTo(ReasonCodes.BACKEND_UNAVAILABLE);
        }
    }
}
