package uk.gegc.planconfigurator.features.catalog.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.planconfigurator.features.catalog.application.CatalogSyncService;

/**
 * Scheduled job that periodically refreshes component offers from the billing backend.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "plan.catalog.sync.enabled", havingValue = "true")
public class CatalogSyncScheduler {

    private final CatalogSyncService catalogSyncService;

    @Scheduled(fixedDelayString = "${plan.catalog.sync.fixed-delay-ms:900000}",
            initialDelayString = "${plan.catalog.sync.initial-delay-ms:5000}")
    public void syncOffers() {
        try {
            catalogSyncService.syncOffers();
        } catch (Exception e) {
            log.warn("CatalogSyncScheduler: error during catalog sync", e);
        }
    }
}
