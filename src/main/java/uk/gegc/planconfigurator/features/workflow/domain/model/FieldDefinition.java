package uk.gegc.planconfigurator.features.workflow.domain.model;

import lombok.Builder;
import lombok.Singular;
import uk.gegc.planconfigurator.features.validation.domain.model.FieldRule;
import uk.gegc.planconfigurator.features.validation.domain.model.ServerCheck;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Static definition of one input of a step.
 *
 * @param visibility  hidden fields are neither validated nor bound into the selection
 * @param binding     {@code null} when the field does not contribute to the selection
 */
@Builder
public record FieldDefinition(
        String id,
        String label,
        boolean required,
        Predicate<StepContext> visibility,
        @Singular List<FieldRule> rules,
        @Singular List<ServerCheck> serverChecks,
        SelectionBinding binding
) {

    public FieldDefinition {
        Objects.requireNonNull(id, "id must not be null");
        label = label != null ? label : id;
        visibility = visibility != null ? visibility : context -> true;
        rules = rules != null ? List.copyOf(rules) : List.of();
        serverChecks = serverChecks != null ? List.copyOf(serverChecks) : List.of();
    }

    public boolean isVisible(StepContext context) {
        return visibility.test(context);
    }
}
