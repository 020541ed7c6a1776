package uk.gegc.planconfigurator.features.catalog.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;
import uk.gegc.planconfigurator.features.catalog.domain.model.ComponentOffer;
import uk.gegc.planconfigurator.features.pricing.domain.model.ComponentKind;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Seed offers and backend sync settings for the component catalog.
 */
@Configuration
@ConfigurationProperties(prefix = "plan.catalog")
@Validated
@Data
public class CatalogProperties {

    @Valid
    private List<Offer> offers = new ArrayList<>();

    @Valid
    private Sync sync = new Sync();

    @Data
    public static class Offer {

        @NotBlank
        private String code;

        @NotBlank
        private String name;

        @NotNull
        private ComponentKind kind;

        @NotNull
        @DecimalMin("0.0")
        private BigDecimal unitPrice;

        private boolean prorationEligible;

        public ComponentOffer toOffer() {
            return new ComponentOffer(code, name, kind, unitPrice, prorationEligible);
        }
    }

    @Data
    public static class Sync {

        /**
         * Refresh offers from the backend on a schedule.
         */
        private boolean enabled = false;

        @Positive
        private long fixedDelayMs = 900_000L;

        /**
         * Only backend components with this status are imported.
         */
        private String status = "active";
    }
}
