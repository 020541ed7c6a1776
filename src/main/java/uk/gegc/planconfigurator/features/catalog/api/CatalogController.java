package uk.gegc.planconfigurator.features.catalog.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.planconfigurator.features.catalog.api.dto.ComponentOfferDto;
import uk.gegc.planconfigurator.features.catalog.application.ComponentCatalog;

import java.util.List;

@Tag(name = "Catalog", description = "Component offers available to plan selections")
@RestController
@RequestMapping("/api/v1/catalog")
@RequiredArgsConstructor
public class CatalogController {

    private final ComponentCatalog componentCatalog;

    @Operation(summary = "List component offers")
    @GetMapping("/offers")
    public List<ComponentOfferDto> listOffers() {
        return componentCatalog.all().stream().map(ComponentOfferDto::from).toList();
    }
}
