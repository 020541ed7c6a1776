package uk.gegc.planconfigurator.features.workflow.infra.persistence;

import uk.gegc.planconfigurator.features.workflow.domain.model.WorkflowState;

import java.util.Optional;

/**
 * Key-value persistence of workflow state keyed by session id.
 */
public interface WorkflowStateStore {

    void save(String sessionId, WorkflowState state);

    Optional<WorkflowState> load(String sessionId);

    void delete(String sessionId);
}
