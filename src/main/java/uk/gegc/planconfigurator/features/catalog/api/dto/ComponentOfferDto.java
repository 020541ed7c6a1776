package uk.gegc.planconfigurator.features.catalog.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.planconfigurator.features.catalog.domain.model.ComponentOffer;
import uk.gegc.planconfigurator.features.pricing.domain.model.ComponentKind;

import java.math.BigDecimal;

@Schema(name = "ComponentOfferDto", description = "Component available for plan selections")
public record ComponentOfferDto(
        @Schema(description = "Component code used as field value", example = "pro")
        String code,
        @Schema(description = "Display name", example = "Pro tier")
        String name,
        @Schema(description = "Billing kind")
        ComponentKind kind,
        @Schema(description = "List unit price in plan currency", example = "49.00")
        BigDecimal unitPrice,
        @Schema(description = "Whether the price is prorated mid-cycle")
        boolean prorationEligible
) {

    public static ComponentOfferDto from(ComponentOffer offer) {
        return new ComponentOfferDto(offer.code(), offer.name(), offer.kind(), offer.unitPrice(), offer.prorationEligible());
    }
}
