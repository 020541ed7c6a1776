package uk.gegc.planconfigurator.features.pricing.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.planconfigurator.features.pricing.domain.model.AppliedDiscount;
import uk.gegc.planconfigurator.features.pricing.domain.model.Component;
import uk.gegc.planconfigurator.features.pricing.domain.model.ComponentKind;
import uk.gegc.planconfigurator.features.pricing.domain.model.Discount;
import uk.gegc.planconfigurator.features.pricing.domain.model.DiscountType;
import uk.gegc.planconfigurator.features.pricing.domain.model.PriceSummary;
import uk.gegc.planconfigurator.features.pricing.domain.model.ProrationPeriod;
import uk.gegc.planconfigurator.features.pricing.domain.model.Selection;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Currency;
import java.util.List;
import java.util.function.Predicate;

/**
 * Derives a {@link PriceSummary} from a selection.
 * <p>
 * Per component kind: subtotal of {@code unitPrice × quantity}; then percentage discounts
 * (summed, capped at 100 %); then flat discounts (summed, never below zero); then a single
 * HALF_EVEN rounding to the currency's minor unit. Discounts of one class are summed before
 * they are applied, so their order in the selection does not affect the result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PricingCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final MathContext WORKING_PRECISION = MathContext.DECIMAL128;
    private static final Comparator<Discount> DISCOUNT_ORDER = Comparator
            .comparing(Discount::appliesTo)
            .thenComparing(Discount::type)
            .thenComparing(Discount::code);

    private final PricingProperties pricingProperties;
    private final Clock clock;

    public PriceSummary computeTotal(Selection selection) {
        return computeTotal(selection, null);
    }

    public PriceSummary computeTotal(Selection selection, ProrationPeriod prorationPeriod) {
        Selection effective = selection != null ? selection : Selection.empty();
        int scale = minorUnitDigits(pricingProperties.getCurrency());
        List<AppliedDiscount> applied = new ArrayList<>();

        BigDecimal recurringSubtotal = subtotal(effective, ComponentKind.RECURRING, null);
        BigDecimal oneTimeSubtotal = subtotal(effective, ComponentKind.ONE_TIME, null);

        BigDecimal recurringTotal = applyDiscounts(recurringSubtotal, effective, ComponentKind.RECURRING, scale, applied);
        BigDecimal oneTimeTotal = applyDiscounts(oneTimeSubtotal, effective, ComponentKind.ONE_TIME, scale, applied);

        BigDecimal proratedRecurringTotal = null;
        if (prorationPeriod != null) {
            BigDecimal prorated = subtotal(effective, ComponentKind.RECURRING, prorationPeriod);
            proratedRecurringTotal = applyDiscounts(prorated, effective, ComponentKind.RECURRING, scale, null);
        }

        PriceSummary summary = new PriceSummary(
                pricingProperties.getCurrency(),
                round(recurringSubtotal, scale),
                round(oneTimeSubtotal, scale),
                round(recurringTotal, scale),
                round(oneTimeTotal, scale),
                proratedRecurringTotal != null ? round(proratedRecurringTotal, scale) : null,
                applied,
                clock.instant()
        );
        log.debug("Computed price: recurring={}, oneTime={}, components={}, discounts={}",
                summary.recurringTotal(), summary.oneTimeTotal(),
                effective.components().size(), effective.discounts().size());
        return summary;
    }

    private BigDecimal subtotal(Selection selection, ComponentKind kind, ProrationPeriod period) {
        BigDecimal subtotal = BigDecimal.ZERO;
        for (Component component : selection.components()) {
            if (component.kind() != kind) {
                continue;
            }
            BigDecimal line = component.lineTotal();
            if (period != null && component.prorationEligible()) {
                line = line.multiply(BigDecimal.valueOf(period.remainingDays()))
                        .divide(BigDecimal.valueOf(period.periodDays()), WORKING_PRECISION);
            }
            subtotal = subtotal.add(line);
        }
        return subtotal;
    }

    /**
     * Unrounded total after discounts. When {@code applied} is non-null the deduction of each
     * discount is reported there, rounded for display only.
     */
    private BigDecimal applyDiscounts(BigDecimal subtotal, Selection selection, ComponentKind kind, int scale,
                                      List<AppliedDiscount> applied) {
        List<Discount> percentages = discountsOf(selection, kind, d -> d.type() == DiscountType.PERCENTAGE);
        List<Discount> flats = discountsOf(selection, kind, d -> d.type() == DiscountType.FLAT);

        BigDecimal requestedPercent = sum(percentages);
        BigDecimal effectivePercent = requestedPercent.min(HUNDRED);
        BigDecimal percentDeduction = subtotal.multiply(effectivePercent).divide(HUNDRED, WORKING_PRECISION);
        BigDecimal afterPercent = subtotal.subtract(percentDeduction);

        BigDecimal requestedFlat = sum(flats);
        BigDecimal flatDeduction = requestedFlat.min(afterPercent);
        BigDecimal total = afterPercent.subtract(flatDeduction).max(BigDecimal.ZERO);

        if (applied != null) {
            // deductions are shared pro rata when a cap kicked in
            for (Discount discount : percentages) {
                applied.add(report(discount, share(discount.amount(), requestedPercent, percentDeduction), scale));
            }
            for (Discount discount : flats) {
                applied.add(report(discount, share(discount.amount(), requestedFlat, flatDeduction), scale));
            }
        }
        return total;
    }

    private static List<Discount> discountsOf(Selection selection, ComponentKind kind, Predicate<Discount> filter) {
        return selection.discounts().stream()
                .filter(discount -> discount.appliesTo() == kind)
                .filter(filter)
                .sorted(DISCOUNT_ORDER)
                .toList();
    }

    private static BigDecimal sum(List<Discount> discounts) {
        return discounts.stream().map(Discount::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal share(BigDecimal part, BigDecimal whole, BigDecimal deduction) {
        if (whole.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return deduction.multiply(part).divide(whole, WORKING_PRECISION);
    }

    private static AppliedDiscount report(Discount discount, BigDecimal deducted, int scale) {
        return new AppliedDiscount(discount.code(), discount.appliesTo(), discount.type(), round(deducted, scale));
    }

    private static BigDecimal round(BigDecimal amount, int scale) {
        return amount.setScale(scale, RoundingMode.HALF_EVEN);
    }

    static int minorUnitDigits(String currencyCode) {
        int digits = Currency.getInstance(currencyCode).getDefaultFractionDigits();
        return Math.max(digits, 0);
    }
}
