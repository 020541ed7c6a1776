package uk.gegc.planconfigurator.features.catalog.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.planconfigurator.features.catalog.domain.model.ComponentOffer;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Offers available to plan selections, keyed by component code. Seeded from configuration
 * and replaced wholesale by catalog sync.
 */
@Slf4j
@Component
public class ComponentCatalog {

    private final AtomicReference<Map<String, ComponentOffer>> offers = new AtomicReference<>(Map.of());

    public ComponentCatalog(CatalogProperties properties) {
        replaceAll(properties.getOffers().stream().map(CatalogProperties.Offer::toOffer).toList());
        log.info("Component catalog seeded with {} offer(s)", offers.get().size());
    }

    public Optional<ComponentOffer> find(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(offers.get().get(code));
    }

    public boolean isKnown(String code) {
        return find(code).isPresent();
    }

    public List<ComponentOffer> all() {
        return List.copyOf(offers.get().values());
    }

    public void replaceAll(Collection<ComponentOffer> replacement) {
        Map<String, ComponentOffer> byCode = new LinkedHashMap<>();
        for (ComponentOffer offer : replacement) {
            byCode.put(offer.code(), offer);
        }
        offers.set(Collections.unmodifiableMap(byCode));
    }
}
