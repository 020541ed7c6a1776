package uk.gegc.planconfigurator.features.workflow.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.With;
import uk.gegc.planconfigurator.features.pricing.domain.model.PriceSummary;
import uk.gegc.planconfigurator.features.pricing.domain.model.Selection;
import uk.gegc.planconfigurator.features.validation.domain.model.ValidationResult;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete state of one configuration session. Immutable; the engine replaces it on every
 * mutation and bumps {@code revision}.
 *
 * @param currentStepId       a step id, {@link #NOT_STARTED} or {@link #COMPLETED}
 * @param fieldValues         values keyed by field id, in the order they were first entered
 * @param history             steps left by advancing, most recent last; {@code back()} pops it
 * @param evaluatedSteps      every step evaluation on the way forward, skipped ones included
 * @param pendingRequestToken ticket of an in-flight advance, {@code null} when none
 */
@With
public record WorkflowState(
        String sessionId,
        String currentStepId,
        Selection selection,
        Map<String, Object> fieldValues,
        Map<String, StepStatus> stepStatuses,
        Map<String, ValidationResult> fieldResults,
        List<String> history,
        List<StepEvaluation> evaluatedSteps,
        PriceSummary priceSummary,
        Long pendingRequestToken,
        long revision,
        Instant updatedAt
) {

    public static final String NOT_STARTED = "NOT_STARTED";
    public static final String COMPLETED = "COMPLETED";

    public WorkflowState {
        selection = selection != null ? selection : Selection.empty();
        fieldValues = copy(fieldValues);
        stepStatuses = copy(stepStatuses);
        fieldResults = copy(fieldResults);
        history = history != null ? List.copyOf(history) : List.of();
        evaluatedSteps = evaluatedSteps != null ? List.copyOf(evaluatedSteps) : List.of();
    }

    public static WorkflowState initial(String sessionId, PriceSummary priceSummary, long revision, Instant now) {
        return new WorkflowState(sessionId, NOT_STARTED, Selection.empty(), Map.of(), Map.of(), Map.of(),
                List.of(), List.of(), priceSummary, null, revision, now);
    }

    @JsonIgnore
    public boolean isNotStarted() {
        return NOT_STARTED.equals(currentStepId);
    }

    @JsonIgnore
    public boolean isCompleted() {
        return COMPLETED.equals(currentStepId);
    }

    @JsonIgnore
    public boolean isOnStep() {
        return !isNotStarted() && !isCompleted();
    }

    @JsonIgnore
    public StepContext context() {
        return new StepContext(sessionId, selection, fieldValues);
    }

    public StepStatus statusOf(String stepId) {
        return stepStatuses.getOrDefault(stepId, StepStatus.NOT_VISITED);
    }

    private static <K, V> Map<K, V> copy(Map<K, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        // LinkedHashMap keeps insertion order; Map.copyOf would not
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
