package uk.gegc.planconfigurator.features.catalog.domain.model;

import uk.gegc.planconfigurator.features.pricing.domain.model.ComponentKind;

import java.math.BigDecimal;

/**
 * A component the operator can put on a plan, with its list price.
 */
public record ComponentOffer(
        String code,
        String name,
        ComponentKind kind,
        BigDecimal unitPrice,
        boolean prorationEligible
) {
}
