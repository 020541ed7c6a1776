package uk.gegc.planconfigurator.features.plan.application;

import uk.gegc.planconfigurator.features.backend.domain.model.BinaryPayload;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Plan operations against the billing backend. Results are in canonical shape.
 */
public interface PlanService {

    /**
     * Creates a plan from a completed workflow session.
     *
     * @throws uk.gegc.planconfigurator.features.workflow.domain.exception.WorkflowStateConflictException
     *         when the session has not completed
     */
    CompletableFuture<Map<String, Object>> submit(String sessionId, String authToken);

    /**
     * Asks the backend to price the session's current selection.
     */
    CompletableFuture<Map<String, Object>> quote(String sessionId, String authToken);

    CompletableFuture<Map<String, Object>> listPlans(String accountId, Integer limit, String status, String authToken);

    CompletableFuture<Map<String, Object>> getPlan(String planId, String authToken);

    CompletableFuture<Map<String, Object>> renamePlan(String planId, String planName, String authToken);

    CompletableFuture<Void> deletePlan(String planId, String authToken);

    CompletableFuture<Map<String, Object>> attach(String planId, BinaryPayload file, String description, String authToken);
}
