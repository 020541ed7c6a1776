package uk.gegc.planconfigurator.features.pricing.domain.model;

import java.math.BigDecimal;
import java.util.Objects;

public record Discount(
        String code,
        ComponentKind appliesTo,
        DiscountType type,
        BigDecimal amount,
        String sourceStepId,
        String sourceFieldId
) {

    public Discount {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(appliesTo, "appliesTo must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(amount, "amount must not be null");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("discount amount must not be negative: " + amount);
        }
    }

    public static Discount percentage(String code, ComponentKind appliesTo, BigDecimal percent) {
        return new Discount(code, appliesTo, DiscountType.PERCENTAGE, percent, null, null);
    }

    public static Discount flat(String code, ComponentKind appliesTo, BigDecimal amount) {
        return new Discount(code, appliesTo, DiscountType.FLAT, amount, null, null);
    }
}
