package uk.gegc.planconfigurator.features.workflow.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.planconfigurator.features.pricing.domain.model.Component;
import uk.gegc.planconfigurator.features.pricing.domain.model.Discount;
import uk.gegc.planconfigurator.features.pricing.domain.model.Selection;
import uk.gegc.planconfigurator.features.workflow.domain.model.BoundItems;
import uk.gegc.planconfigurator.features.workflow.domain.model.FieldDefinition;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepCatalog;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepContext;
import uk.gegc.planconfigurator.features.workflow.domain.model.StepDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;

/**
 * Rebuilds the selection from field values, in step then field order.
 * <p>
 * Visibility predicates read the selection, so assembly runs twice: first with every bound
 * field, then keeping only fields that are visible under the first result.
 */
@Service
@RequiredArgsConstructor
public class SelectionAssembler {

    private final StepCatalog stepCatalog;

    public Selection assemble(Map<String, Object> fieldValues) {
        Selection everything = bind(fieldValues, (step, field) -> true);
        StepContext context = new StepContext(everything, fieldValues);
        return bind(fieldValues, (step, field) -> step.visibleFields(context).contains(field));
    }

    private Selection bind(Map<String, Object> fieldValues, BiPredicate<StepDefinition, FieldDefinition> include) {
        StepContext context = new StepContext(Selection.empty(), fieldValues);
        List<Component> components = new ArrayList<>();
        List<Discount> discounts = new ArrayList<>();
        for (StepDefinition step : stepCatalog.steps()) {
            for (FieldDefinition field : step.fields()) {
                Object value = fieldValues.get(field.id());
                if (field.binding() == null || value == null || !include.test(step, field)) {
                    continue;
                }
                BoundItems bound = field.binding().bind(step.id(), field.id(), value, context);
                components.addAll(bound.components());
                discounts.addAll(bound.discounts());
            }
        }
        return new Selection(components, discounts);
    }
}
