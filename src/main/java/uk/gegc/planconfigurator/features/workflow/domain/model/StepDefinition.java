package uk.gegc.planconfigurator.features.workflow.domain.model;

import lombok.Builder;
import lombok.Singular;
import uk.gegc.planconfigurator.features.workflow.domain.exception.UnknownFieldException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Static definition of a workflow step.
 *
 * @param visibility step-level predicate; an invisible step has no visible fields and is skipped
 * @param next       pure resolver of the following step from the current snapshot
 */
@Builder
public record StepDefinition(
        String id,
        String title,
        int ordinal,
        @Singular List<FieldDefinition> fields,
        Predicate<StepContext> visibility,
        Function<StepContext, NextStep> next
) {

    public StepDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(next, "next-step resolver must not be null for step " + id);
        title = title != null ? title : id;
        fields = fields != null ? List.copyOf(fields) : List.of();
        visibility = visibility != null ? visibility : context -> true;
    }

    public List<FieldDefinition> visibleFields(StepContext context) {
        if (!visibility.test(context)) {
            return List.of();
        }
        return fields.stream().filter(field -> field.isVisible(context)).toList();
    }

    public Optional<FieldDefinition> findField(String fieldId) {
        return fields.stream().filter(field -> field.id().equals(fieldId)).findFirst();
    }

    public FieldDefinition field(String fieldId) {
        return findField(fieldId).orElseThrow(() -> new UnknownFieldException(id, fieldId));
    }

    public NextStep resolveNext(StepContext context) {
        return next.apply(context);
    }
}
