package uk.gegc.planconfigurator.features.pricing.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Derived totals for a selection. Never mutated; recomputed on every selection change.
 *
 * @param proratedRecurringTotal recurring total for the remainder of the cycle, {@code null}
 *                               when no proration period was given
 */
public record PriceSummary(
        String currency,
        BigDecimal recurringSubtotal,
        BigDecimal oneTimeSubtotal,
        BigDecimal recurringTotal,
        BigDecimal oneTimeTotal,
        BigDecimal proratedRecurringTotal,
        List<AppliedDiscount> discounts,
        Instant computedAt
) {

    public PriceSummary {
        discounts = discounts == null ? List.of() : List.copyOf(discounts);
    }
}
