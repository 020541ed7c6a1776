package uk.gegc.planconfigurator.features.pricing.domain.model;

import java.util.List;

/**
 * Components and discounts chosen so far, in the order they were bound. Immutable.
 */
public record Selection(List<Component> components, List<Discount> discounts) {

    private static final Selection EMPTY = new Selection(List.of(), List.of());

    public Selection {
        components = components == null ? List.of() : List.copyOf(components);
        discounts = discounts == null ? List.of() : List.copyOf(discounts);
    }

    public static Selection empty() {
        return EMPTY;
    }

    public static Selection of(List<Component> components) {
        return new Selection(components, List.of());
    }

    public boolean containsCode(String code) {
        return components.stream().anyMatch(component -> component.code().equals(code));
    }
}
