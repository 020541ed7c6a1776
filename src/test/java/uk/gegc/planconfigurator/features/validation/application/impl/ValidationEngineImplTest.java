package uk.gegc.planconfigurator.features.validation.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.planconfigurator.features.validation.application.FieldRules;
import uk.gegc.planconfigurator.features.validation.domain.model.ReasonCodes;
import uk.gegc.planconfigurator.features.validation.domain.model.ServerCheck;
import uk.gegc.planconfigurator.features.validation.domain.model.StepValidationReport;
import uk.gegc.planconfigurator.features.validation.domain.model.ValidationResult;
import uk.gegc.planconfigurator.features.workflow.domain.exception.UnknownFieldException;
import uk.gegc.planconfigurator.features.workflow.domain.exception.UnknownStepException;
import uk.gegc.planconfigurator.features.workflow.domain.model.FieldDefinition;
import uk.gegc.planconfigurator.features.workflow.domain.model.NextStep;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepCatalog;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepContext;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepDefinition;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ValidationEngineImpl")
class ValidationEngineImplTest {

    private RecordingCheck uniqueName;
    private CompletableFuture<ValidationResult> slowCheckResult;
    private ValidationEngineImpl engine;

    @BeforeEach
    void setUp() {
        uniqueName = new RecordingCheck("plan-name-unique", CompletableFuture.completedFuture(ValidationResult.valid()));
        slowCheckResult = new CompletableFuture<>();

        StepDefinition account = StepDefinition.builder()
                .id("account")
                .ordinal(0)
                .field(FieldDefinition.builder()
                        .id("planName")
                        .label("Plan name")
                        .required(true)
                        .rule(FieldRules.maxLength(10))
                        .serverCheck(uniqueName)
                        .build())
                .field(FieldDefinition.builder()
                        .id("seats")
                        .rule(FieldRules.integral())
                        .rule(FieldRules.range(1, 5))
                        .build())
                .field(FieldDefinition.builder()
                        .id("note")
                        .required(true)
                        .visibility(context -> context.valueEquals("seats", 5L))
                        .build())
                .next(context -> NextStep.to("review"))
                .build();
        StepDefinition review = StepDefinition.builder()
                .id("review")
                .ordinal(1)
                .field(FieldDefinition.builder()
                        .id("confirm")
                        .required(true)
                        .serverCheck(new RecordingCheck("slow", slowCheckResult))
                        .build())
                .next(context -> NextStep.finished())
                .build();

        engine = new ValidationEngineImpl(new StepCatalog(List.of(review, account)));
    }

    @Nested
    @DisplayName("validateField")
    class ValidateField {

        @Test
        @DisplayName("missing required value is REQUIRED")
        void required() {
            ValidationResult result = engine.validateField("account", "planName", "  ");

            assertThat(result.isInvalid()).isTrue();
            assertThat(result.reasonCode()).isEqualTo(ReasonCodes.REQUIRED);
            assertThat(result.message()).isEqualTo("Plan name is required");
        }

        @Test
        @DisplayName("optional blank value is valid without running rules")
        void optionalBlank() {
            assertThat(engine.validateField("account", "seats", null).isValid()).isTrue();
        }

        @Test
        @DisplayName("first failing rule wins")
        void firstFailingRule() {
            ValidationResult result = engine.validateField("account", "seats", new java.math.BigDecimal("2.5"));

            assertThat(result.reasonCode()).isEqualTo(ReasonCodes.INVALID_TYPE);
        }

        @Test
        @DisplayName("never calls server checks")
        void noServerChecks() {
            engine.validateField("account", "planName", "Team plan");

            assertThat(uniqueName.calls.get()).isZero();
        }

        @Test
        @DisplayName("unknown step and field are rejected")
        void unknownIds() {
            assertThatThrownBy(() -> engine.validateField("nope", "planName", "x"))
                    .isInstanceOf(UnknownStepException.class);
            assertThatThrownBy(() -> engine.validateField("account", "confirm", true))
                    .isInstanceOf(UnknownFieldException.class);
        }
    }

    @Nested
    @DisplayName("validateStep")
    class ValidateStep {

        @Test
        @DisplayName("reports every visible field and skips hidden ones")
        void visibleFieldsOnly() {
            StepContext context = new StepContext(null, Map.of("planName", "Team", "seats", 3L));

            StepValidationReport report = engine.validateStep("account", context, "token").join();

            assertThat(report.fieldResults()).containsOnlyKeys("planName", "seats");
            assertThat(report.advanceable()).isTrue();
        }

        @Test
        @DisplayName("a field revealed by another value is validated")
        void revealedField() {
            StepContext context = new StepContext(null, Map.of("planName", "Team", "seats", 5L));

            StepValidationReport report = engine.validateStep("account", context, "token").join();

            assertThat(report.fieldResults()).containsKey("note");
            assertThat(report.advanceable()).isFalse();
            assertThat(report.firstFailure()).hasValueSatisfying(entry -> assertThat(entry.getKey()).isEqualTo("note"));
        }

        @Test
        @DisplayName("server checks are not dispatched when a local rule fails")
        void localFailureShortCircuits() {
            StepContext context = new StepContext(null, Map.of("planName", "Team", "seats", 9L));

            StepValidationReport report = engine.validateStep("account", context, "token").join();

            assertThat(report.fieldResults().get("seats").reasonCode()).isEqualTo(ReasonCodes.OUT_OF_RANGE);
            assertThat(uniqueName.calls.get()).isZero();
        }

        @Test
        @DisplayName("server check failure blocks the field it belongs to")
        void serverCheckFailure() {
            uniqueName.result = CompletableFuture.completedFuture(
                    ValidationResult.invalid(ReasonCodes.NOT_UNIQUE, "taken"));
            StepContext context = new StepContext(null, Map.of("planName", "Team", "seats", 1L));

            StepValidationReport report = engine.validateStep("account", context, "token").join();

            assertThat(uniqueName.calls.get()).isEqualTo(1);
            assertThat(uniqueName.lastToken).isEqualTo("token");
            assertThat(report.fieldResults().get("planName").reasonCode()).isEqualTo(ReasonCodes.NOT_UNIQUE);
            assertThat(report.fieldResults().get("seats").isValid()).isTrue();
            assertThat(report.advanceable()).isFalse();
        }

        @Test
        @DisplayName("the report completes only when every server check settled")
        void waitsForServerChecks() {
            StepContext context = new StepContext(null, Map.of("confirm", true));

            CompletableFuture<StepValidationReport> report = engine.validateStep("review", context, null);

            assertThat(report).isNotDone();
            slowCheckResult.complete(ValidationResult.pending("later"));
            assertThat(report.join().advanceable()).isFalse();
            assertThat(report.join().fieldResults().get("confirm").status()).isEqualTo(ValidationResult.Status.PENDING);
        }
    }

    private static final class RecordingCheck implements ServerCheck {

        private final String name;
        private final AtomicInteger calls = new AtomicInteger();
        private volatile CompletableFuture<ValidationResult> result;
        private volatile String lastToken;

        private RecordingCheck(String name, CompletableFuture<ValidationResult> result) {
            this.name = name;
            this.result = result;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public CompletableFuture<ValidationResult> check(Object value, StepContext context, String authToken) {
            calls.incrementAndGet();
            lastToken = authToken;
            return result;
        }
    }
}
