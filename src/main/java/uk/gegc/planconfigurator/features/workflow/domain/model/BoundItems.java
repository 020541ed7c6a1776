package uk.gegc.planconfigurator.features.workflow.domain.model;

import uk.gegc.planconfigurator.features.pricing.domain.model.Component;
import uk.gegc.planconfigurator.features.pricing.domain.model.Discount;

import java.util.List;

public record BoundItems(List<Component> components, List<Discount> discounts) {

    private static final BoundItems NONE = new BoundItems(List.of(), List.of());

    public BoundItems {
        components = List.copyOf(components);
        discounts = List.copyOf(discounts);
    }

    public static BoundItems none() {
        return NONE;
    }

    public static BoundItems of(Component... components) {
        return new BoundItems(List.of(components), List.of());
    }

    public static BoundItems of(Discount discount) {
        return new BoundItems(List.of(), List.of(discount));
    }
}
