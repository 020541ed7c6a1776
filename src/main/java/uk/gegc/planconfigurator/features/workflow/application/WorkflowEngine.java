package uk.gegc.planconfigurator.features.workflow.application;

import uk.gegc.planconfigurator.features.workflow.domain.model.WorkflowState;

import java.util.concurrent.CompletableFuture;

/**
 * State machine over the plan workflow steps. The only component that creates or replaces
 * {@link WorkflowState}.
 * <p>
 * Every operation except {@link #start} requires an existing session, in memory or in the
 * state store, and throws
 * {@link uk.gegc.planconfigurator.features.workflow.domain.exception.WorkflowSessionNotFoundException}
 * otherwise.
 */
public interface WorkflowEngine {

    /**
     * Creates (or resumes) the session and enters the first visible step if it has not started.
     */
    WorkflowView start(String sessionId);

    /**
     * Validates the current step and moves on when it passes. Before start this enters the
     * first step; after completion it is a no-op.
     */
    CompletableFuture<AdvanceResult> advance(String sessionId, String authToken);

    /**
     * Returns to the previously visited step, keeping all entered data. No-op on the first
     * step and before start.
     */
    WorkflowView back(String sessionId);

    /**
     * Stores a value, validates the field locally, rebinds the selection and recomputes price.
     * {@code null} or blank clears the field.
     */
    WorkflowView updateField(String sessionId, String stepId, String fieldId, Object value);

    /**
     * Back to not-started with an empty selection. Cancels any in-flight advance.
     */
    WorkflowView reset(String sessionId);

    /**
     * Clears the values of one step and the selection items they produced.
     */
    WorkflowView resetStep(String sessionId, String stepId);

    WorkflowView view(String sessionId);

    WorkflowState state(String sessionId);
}
