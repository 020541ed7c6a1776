package uk.gegc.planconfigurator.features.pricing.domain.model;

public enum DiscountType {
    /** Amount is a percentage of the subtotal of its kind, e.g. 10 for 10 %. */
    PERCENTAGE,
    /** Amount is money in the plan currency. */
    FLAT
}
