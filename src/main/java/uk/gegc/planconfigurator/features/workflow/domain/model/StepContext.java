package uk.gegc.planconfigurator.features.workflow.domain.model;

import uk.gegc.planconfigurator.features.pricing.domain.model.Selection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read snapshot handed to visibility predicates, next-step resolvers and validation.
 *
 * @param sessionId workflow session the snapshot belongs to, {@code null} outside a session
 */
public record StepContext(String sessionId, Selection selection, Map<String, Object> fieldValues) {

    public StepContext {
        selection = selection != null ? selection : Selection.empty();
        fieldValues = fieldValues == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fieldValues));
    }

    public StepContext(Selection selection, Map<String, Object> fieldValues) {
        this(null, selection, fieldValues);
    }

    public Object value(String fieldId) {
        return fieldValues.get(fieldId);
    }

    public boolean has(String fieldId) {
        return fieldValues.get(fieldId) != null;
    }

    public boolean valueEquals(String fieldId, Object expected) {
        return expected.equals(fieldValues.get(fieldId));
    }
}
