package uk.gegc.planconfigurator.features.workflow.domain.model;

/**
 * Turns a field value into the plan components or discounts it stands for.
 */
@FunctionalInterface
public interface SelectionBinding {

    /**
     * @param value   current, non-null value of the bound field
     * @param context all field values, for bindings that read a companion field (e.g. a quantity)
     */
    BoundItems bind(String stepId, String fieldId, Object value, StepContext context);
}
