package uk.gegc.planconfigurator.features.pricing.domain.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Plan line item.
 *
 * @param id                stable identity within a selection: {@code <fieldId>:<code>}
 * @param sourceStepId      step whose field produced this component
 * @param sourceFieldId     field whose value produced this component
 */
@Builder(toBuilder = true)
public record Component(
        String id,
        String code,
        String name,
        ComponentKind kind,
        BigDecimal unitPrice,
        long quantity,
        boolean prorationEligible,
        String sourceStepId,
        String sourceFieldId
) {

    public Component {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(unitPrice, "unitPrice must not be null");
        if (quantity < 0) {
            throw new IllegalArgumentException("quantity must not be negative: " + quantity);
        }
        if (unitPrice.signum() < 0) {
            throw new IllegalArgumentException("unitPrice must not be negative: " + unitPrice);
        }
    }

    public BigDecimal lineTotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
