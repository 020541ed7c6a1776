package uk.gegc.planconfigurator.features.workflow.domain.model;

import uk.gegc.planconfigurator.features.workflow.domain.exception.UnknownStepException;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, read-only set of step definitions. Field ids are unique across all steps, so
 * field values can be stored flat.
 */
public class StepCatalog {

    private final Map<String, StepDefinition> steps;

    public StepCatalog(List<StepDefinition> definitions) {
        if (definitions.isEmpty()) {
            throw new IllegalArgumentException("A workflow needs at least one step");
        }
        Map<String, StepDefinition> ordered = new LinkedHashMap<>();
        Set<String> fieldIds = new HashSet<>();
        definitions.stream()
                .sorted(Comparator.comparingInt(StepDefinition::ordinal))
                .forEach(step -> {
                    if (ordered.putIfAbsent(step.id(), step) != null) {
                        throw new IllegalArgumentException("Duplicate step id: " + step.id());
                    }
                    for (FieldDefinition field : step.fields()) {
                        if (!fieldIds.add(field.id())) {
                            throw new IllegalArgumentException("Duplicate field id: " + field.id());
                        }
                    }
                });
        this.steps = Collections.unmodifiableMap(ordered);
    }

    public StepDefinition first() {
        return steps.values().iterator().next();
    }

    public StepDefinition step(String stepId) {
        StepDefinition step = steps.get(stepId);
        if (step == null) {
            throw new UnknownStepException(stepId);
        }
        return step;
    }

    public boolean contains(String stepId) {
        return steps.containsKey(stepId);
    }

    public List<StepDefinition> steps() {
        return List.copyOf(steps.values());
    }

    public int size() {
        return steps.size();
    }
}
