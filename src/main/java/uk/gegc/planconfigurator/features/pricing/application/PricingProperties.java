package uk.gegc.planconfigurator.features.pricing.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;
import uk.gegc.planconfigurator.features.pricing.domain.model.ComponentKind;
import uk.gegc.planconfigurator.features.pricing.domain.model.Discount;
import uk.gegc.planconfigurator.features.pricing.domain.model.DiscountType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pricing configuration: plan currency and the promotion codes operators may apply.
 */
@Configuration
@ConfigurationProperties(prefix = "pricing")
@Validated
@Data
public class PricingProperties {

    /**
     * ISO 4217 code; its default fraction digits define the rounding unit.
     */
    @NotBlank
    @Pattern(regexp = "[A-Z]{3}")
    private String currency = "USD";

    @Valid
    private List<Promotion> promotions = new ArrayList<>();

    public Optional<Promotion> findPromotion(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return promotions.stream()
                .filter(promotion -> promotion.getCode().equalsIgnoreCase(normalized))
                .findFirst();
    }

    @Data
    public static class Promotion {

        @NotBlank
        private String code;

        @NotNull
        private ComponentKind appliesTo = ComponentKind.RECURRING;

        @NotNull
        private DiscountType type = DiscountType.PERCENTAGE;

        @NotNull
        @DecimalMin("0.0")
        private BigDecimal amount;

        public Discount toDiscount(String sourceStepId, String sourceFieldId) {
            return new Discount(code.toUpperCase(Locale.ROOT), appliesTo, type, amount, sourceStepId, sourceFieldId);
        }
    }
}
