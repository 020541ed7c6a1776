package uk.gegc.planconfigurator.features.validation.application;

import uk.gegc.planconfigurator.features.catalog.application.ComponentCatalog;
import uk.gegc.planconfigurator.features.catalog.domain.model.ComponentOffer;
import uk.gegc.planconfigurator.features.pricing.application.PricingProperties;
import uk.gegc.planconfigurator.features.pricing.domain.model.ComponentKind;
import uk.gegc.planconfigurator.features.validation.domain.model.FieldRule;
import uk.gegc.planconfigurator.features.validation.domain.model.ReasonCodes;
import uk.gegc.planconfigurator.features.validation.domain.model.ValidationResult;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Factory methods for the local rules used by the plan workflow.
 */
public final class FieldRules {

    private FieldRules() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static FieldRule maxLength(int max) {
        return value -> {
            if (!(value instanceof String text)) {
                return typeMismatch("text");
            }
            return text.length() <= max
                    ? ValidationResult.valid()
                    : ValidationResult.invalid(ReasonCodes.TOO_LONG, "Must be at most " + max + " characters");
        };
    }

    public static FieldRule pattern(String regex, String description) {
        Pattern compiled = Pattern.compile(regex);
        return value -> {
            if (!(value instanceof String text)) {
                return typeMismatch("text");
            }
            return compiled.matcher(text).matches()
                    ? ValidationResult.valid()
                    : ValidationResult.invalid(ReasonCodes.PATTERN_MISMATCH, description);
        };
    }

    /**
     * Inclusive numeric range.
     */
    public static FieldRule range(long min, long max) {
        return value -> {
            Optional<BigDecimal> number = asNumber(value);
            if (number.isEmpty()) {
                return typeMismatch("number");
            }
            BigDecimal n = number.get();
            if (n.compareTo(BigDecimal.valueOf(min)) < 0 || n.compareTo(BigDecimal.valueOf(max)) > 0) {
                return ValidationResult.invalid(ReasonCodes.OUT_OF_RANGE, "Must be between " + min + " and " + max);
            }
            return ValidationResult.valid();
        };
    }

    public static FieldRule integral() {
        return value -> {
            Optional<BigDecimal> number = asNumber(value);
            if (number.isEmpty()) {
                return typeMismatch("number");
            }
            return number.get().stripTrailingZeros().scale() <= 0
                    ? ValidationResult.valid()
                    : ValidationResult.invalid(ReasonCodes.INVALID_TYPE, "Must be a whole number");
        };
    }

    public static FieldRule oneOf(Set<String> allowed) {
        return value -> allowed.contains(String.valueOf(value))
                ? ValidationResult.valid()
                : ValidationResult.invalid(ReasonCodes.NOT_ALLOWED, "Must be one of " + allowed);
    }

    public static FieldRule isTrue(String message) {
        return value -> Boolean.TRUE.equals(value)
                ? ValidationResult.valid()
                : ValidationResult.invalid(ReasonCodes.REQUIRED, message);
    }

    /**
     * Value must be the code of a catalog offer whose code starts with {@code codePrefix}
     * and whose kind matches.
     */
    public static FieldRule knownOffer(ComponentCatalog catalog, String codePrefix, ComponentKind kind) {
        return value -> {
            if (!(value instanceof String code)) {
                return typeMismatch("component code");
            }
            return catalog.find(code)
                    .filter(offer -> offer.kind() == kind && offer.code().startsWith(codePrefix))
                    .map(offer -> ValidationResult.valid())
                    .orElseGet(() -> ValidationResult.invalid(ReasonCodes.NOT_FOUND, "Unknown option: " + code));
        };
    }

    /**
     * Value is a map of catalog code to quantity, e.g. add-ons.
     */
    public static FieldRule knownOfferQuantities(ComponentCatalog catalog, String codePrefix, long maxQuantity) {
        return value -> {
            if (!(value instanceof Map<?, ?> quantities)) {
                return typeMismatch("map of option to quantity");
            }
            for (Map.Entry<?, ?> entry : quantities.entrySet()) {
                String code = String.valueOf(entry.getKey());
                Optional<ComponentOffer> offer = catalog.find(code).filter(o -> o.code().startsWith(codePrefix));
                if (offer.isEmpty()) {
                    return ValidationResult.invalid(ReasonCodes.NOT_FOUND, "Unknown option: " + code);
                }
                Optional<BigDecimal> quantity = asNumber(entry.getValue());
                if (quantity.isEmpty() || quantity.get().signum() < 0
                        || quantity.get().compareTo(BigDecimal.valueOf(maxQuantity)) > 0) {
                    return ValidationResult.invalid(ReasonCodes.OUT_OF_RANGE,
                            "Quantity for " + code + " must be between 0 and " + maxQuantity);
                }
            }
            return ValidationResult.valid();
        };
    }

    public static FieldRule knownPromotion(PricingProperties pricingProperties) {
        return value -> {
            if (!(value instanceof String code)) {
                return typeMismatch("promotion code");
            }
            return pricingProperties.findPromotion(code).isPresent()
                    ? ValidationResult.valid()
                    : ValidationResult.invalid(ReasonCodes.NOT_FOUND, "Unknown promotion code: " + code);
        };
    }

    static Optional<BigDecimal> asNumber(Object value) {
        if (value instanceof BigDecimal decimal) {
            return Optional.of(decimal);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return Optional.of(BigDecimal.valueOf(((Number) value).longValue()));
        }
        if (value instanceof Number number) {
            return Optional.of(new BigDecimal(number.toString()));
        }
        return Optional.empty();
    }

    private static ValidationResult typeMismatch(String expected) {
        return ValidationResult.invalid(ReasonCodes.INVALID_TYPE, "Expected " + expected);
    }
}
