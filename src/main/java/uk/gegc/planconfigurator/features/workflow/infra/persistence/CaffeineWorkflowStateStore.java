package uk.gegc.planconfigurator.features.workflow.infra.persistence;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;
import uk.gegc.planconfigurator.features.workflow.application.WorkflowProperties;
import uk.gegc.planconfigurator.features.workflow.domain.model.WorkflowState;

import java.util.Optional;

/**
 * {@link WorkflowStateStore} holding serialized state in a bounded Caffeine cache.
 */
@Component
public class CaffeineWorkflowStateStore implements WorkflowStateStore {

    private final Cache<String, String> entries;
    private final WorkflowStateSerializer serializer;

    public CaffeineWorkflowStateStore(WorkflowProperties properties, WorkflowStateSerializer serializer) {
        this.serializer = serializer;
        this.entries = Caffeine.newBuilder()
                .expireAfterWrite(properties.getStateTtl())
                .maximumSize(properties.getMaxSessions())
                .build();
    }

    @Override
    public void save(String sessionId, WorkflowState state) {
        entries.put(sessionId, serializer.serialize(state));
    }

    @Override
    public Optional<WorkflowState> load(String sessionId) {
        String json = entries.getIfPresent(sessionId);
        if (json == null) {
            return Optional.empty();
        }
        return Optional.of(serializer.deserialize(json));
    }

    @Override
    public void delete(String sessionId) {
        entries.invalidate(sessionId);
    }
}
