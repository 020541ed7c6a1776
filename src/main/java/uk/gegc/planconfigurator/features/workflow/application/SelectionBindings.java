package uk.gegc.planconfigurator.features.workflow.application;

import uk.gegc.planconfigurator.features.catalog.application.ComponentCatalog;
import uk.gegc.planconfigurator.features.catalog.domain.model.ComponentOffer;
import uk.gegc.planconfigurator.features.pricing.application.PricingProperties;
import uk.gegc.planconfigurator.features.pricing.domain.model.Component;
import uk.gegc.planconfigurator.features.workflow.domain.model.BoundItems;
import uk.gegc.planconfigurator.features.workflow.domain.model.SelectionBinding;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Bindings from field values to selection items. Values that do not resolve (unknown codes,
 * zero quantities) bind nothing; validation reports them.
 */
public final class SelectionBindings {

    private SelectionBindings() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Value is an offer code. Quantity comes from {@code quantityFieldId}, or 1 when that is
     * {@code null} or unset.
     */
    public static SelectionBinding offer(ComponentCatalog catalog, String quantityFieldId) {
        return (stepId, fieldId, value, context) -> {
            long quantity = quantityFieldId != null ? FieldValues.asLong(context.value(quantityFieldId), 1L) : 1L;
            if (quantity <= 0) {
                return BoundItems.none();
            }
            return catalog.find(String.valueOf(value))
                    .map(offer -> BoundItems.of(component(offer, quantity, stepId, fieldId)))
                    .orElse(BoundItems.none());
        };
    }

    /**
     * Value is a quantity of the fixed offer {@code code}, e.g. migration hours.
     */
    public static SelectionBinding quantityOf(ComponentCatalog catalog, String code) {
        return (stepId, fieldId, value, context) -> {
            long quantity = FieldValues.asLong(value, 0L);
            if (quantity <= 0) {
                return BoundItems.none();
            }
            return catalog.find(code)
                    .map(offer -> BoundItems.of(component(offer, quantity, stepId, fieldId)))
                    .orElse(BoundItems.none());
        };
    }

    /**
     * Value is a map of offer code to quantity, e.g. add-ons.
     */
    public static SelectionBinding offerQuantities(ComponentCatalog catalog) {
        return (stepId, fieldId, value, context) -> {
            if (!(value instanceof Map<?, ?> quantities)) {
                return BoundItems.none();
            }
            List<Component> components = new ArrayList<>();
            quantities.forEach((code, quantity) -> {
                long count = FieldValues.asLong(quantity, 0L);
                if (count > 0) {
                    catalog.find(String.valueOf(code))
                            .ifPresent(offer -> components.add(component(offer, count, stepId, fieldId)));
                }
            });
            return new BoundItems(components, List.of());
        };
    }

    public static SelectionBinding promotion(PricingProperties pricingProperties) {
        return (stepId, fieldId, value, context) -> pricingProperties.findPromotion(String.valueOf(value))
                .map(promotion -> BoundItems.of(promotion.toDiscount(stepId, fieldId)))
                .orElse(BoundItems.none());
    }

    private static Component component(ComponentOffer offer, long quantity, String stepId, String fieldId) {
        return Component.builder()
                .id(fieldId + ":" + offer.code())
                .code(offer.code())
                .name(offer.name())
                .kind(offer.kind())
                .unitPrice(offer.unitPrice())
                .quantity(quantity)
                .prorationEligible(offer.prorationEligible())
                .sourceStepId(stepId)
                .sourceFieldId(fieldId)
                .build();
    }
}
