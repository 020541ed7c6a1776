package uk.gegc.planconfigurator.features.workflow.infra.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;
import uk.gegc.planconfigurator.features.workflow.domain.model.WorkflowState;

/**
 * JSON form of {@link WorkflowState}.
 * <p>
 * Uses its own mapper so the stored format does not follow changes to the web layer's
 * Jackson settings. Whole numbers read back as Long and decimals as BigDecimal, matching
 * the types the engine stores.
 */
@Component
public class WorkflowStateSerializer {

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(DeserializationFeature.USE_LONG_FOR_INTS)
            .build();

    public String serialize(WorkflowState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new WorkflowStateSerializationException(
                    "Failed to serialize workflow state for session " + state.sessionId(), e);
        }
    }

    public WorkflowState deserialize(String json) {
        try {
            return objectMapper.readValue(json, WorkflowState.class);
        } catch (JsonProcessingException e) {
            throw new WorkflowStateSerializationException("Failed to deserialize workflow state", e);
        }
    }
}
