package uk.gegc.planconfigurator.features.catalog.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.planconfigurator.features.backend.application.BackendClient;
import uk.gegc.planconfigurator.features.backend.application.BackendProperties;
import uk.gegc.planconfigurator.features.backend.domain.model.OperationParams;
import uk.gegc.planconfigurator.features.backend.domain.model.ResponseEnvelope;
import uk.gegc.planconfigurator.features.backend.infra.config.BackendEndpointCatalog;
import uk.gegc.planconfigurator.features.catalog.application.CatalogProperties;
import uk.gegc.planconfigurator.features.catalog.application.CatalogSyncService;
import uk.gegc.planconfigurator.features.catalog.application.ComponentCatalog;
import uk.gegc.planconfigurator.features.catalog.domain.model.ComponentOffer;
import uk.gegc.planconfigurator.features.pricing.application.PricingProperties;
import uk.gegc.planconfigurator.features.pricing.domain.model.ComponentKind;
import uk.gegc.planconfigurator.shared.util.FutureUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Default implementation of {@link CatalogSyncService} on the {@code catalog-components} operation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogSyncServiceImpl implements CatalogSyncService {

    private static final int PAGE_LIMIT = 200;

    private final BackendClient backendClient;
    private final BackendProperties backendProperties;
    private final CatalogProperties catalogProperties;
    private final PricingProperties pricingProperties;
    private final ComponentCatalog componentCatalog;

    @Override
    public int syncOffers() {
        if (!StringUtils.hasText(backendProperties.getServiceToken())) {
            log.debug("CatalogSyncService: service token not configured; skipping catalog sync");
            return 0;
        }

        log.info("CatalogSyncService: starting sync of component offers from backend");
        OperationParams params = OperationParams.builder()
                .limit(PAGE_LIMIT)
                .filter("status", catalogProperties.getSync().getStatus())
                .build();
        ResponseEnvelope response = FutureUtils.join(backendClient.call(
                BackendEndpointCatalog.CATALOG_COMPONENTS, params, backendProperties.getServiceToken()));

        List<ComponentOffer> offers = toOffers(response.data());
        if (offers.isEmpty()) {
            log.warn("CatalogSyncService: backend returned no usable components; leaving existing offers unchanged");
            return 0;
        }

        componentCatalog.replaceAll(offers);
        log.info("CatalogSyncService: completed sync, {} offer(s) in catalog", offers.size());
        return offers.size();
    }

    @SuppressWarnings("unchecked")
    private List<ComponentOffer> toOffers(Map<String, Object> data) {
        List<ComponentOffer> offers = new ArrayList<>();
        Object items = data.get("items");
        if (!(items instanceof List<?> list)) {
            return offers;
        }
        String desiredCurrency = pricingProperties.getCurrency();
        for (Object element : list) {
            Map<String, Object> item = (Map<String, Object>) element;
            String code = (String) item.get("code");
            String currency = (String) item.get("currency");
            if (StringUtils.hasText(currency) && !currency.equalsIgnoreCase(desiredCurrency)) {
                log.debug("CatalogSyncService: skipping component '{}' priced in {}", code, currency);
                continue;
            }
            ComponentKind kind;
            try {
                kind = ComponentKind.fromWire((String) item.get("kind"));
            } catch (IllegalArgumentException e) {
                log.warn("CatalogSyncService: skipping component '{}': {}", code, e.getMessage());
                continue;
            }
            BigDecimal unitPrice = (BigDecimal) item.get("unitPrice");
            if (unitPrice == null || unitPrice.signum() < 0) {
                log.warn("CatalogSyncService: skipping component '{}' with invalid unit price {}", code, unitPrice);
                continue;
            }
            boolean prorate = Boolean.TRUE.equals(item.get("prorationEligible"));
            offers.add(new ComponentOffer(code, (String) item.get("name"), kind,
                    unitPrice, prorate && kind == ComponentKind.RECURRING));
        }
        return offers;
    }
}
