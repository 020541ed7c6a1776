package uk.gegc.planconfigurator.features.pricing.domain.model;

import java.math.BigDecimal;

/**
 * A discount as it was applied: {@code deducted} is the money it removed, in the plan currency.
 */
public record AppliedDiscount(String code, ComponentKind appliesTo, DiscountType type, BigDecimal deducted) {
}
