package uk.gegc.planconfigurator.features.workflow.application;

import uk.gegc.planconfigurator.features.pricing.domain.model.Component;
import uk.gegc.planconfigurator.features.pricing.domain.model.PriceSummary;
import uk.gegc.planconfigurator.features.validation.domain.model.ValidationResult;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepStatus;

import java.util.List;

/**
 * Read-only projection of a session for the presentation layer.
 *
 * @param visibleFields fields of the current step visible under the current selection; empty
 *                      before start and after completion
 * @param advancePending an advance is waiting for server checks
 */
public record WorkflowView(
        String sessionId,
        Phase phase,
        String currentStepId,
        String currentStepTitle,
        List<FieldView> visibleFields,
        List<StepView> steps,
        List<Component> components,
        PriceSummary priceSummary,
        boolean advancePending,
        boolean canGoBack,
        long revision
) {

    public enum Phase {
        NOT_STARTED,
        IN_PROGRESS,
        COMPLETED
    }

    /**
     * @param result {@code null} until the field was edited or its step validated
     */
    public record FieldView(String id, String label, boolean required, Object value, ValidationResult result) {
    }

    public record StepView(String id, String title, StepStatus status) {
    }
}
