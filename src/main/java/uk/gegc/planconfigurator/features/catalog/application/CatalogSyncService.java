package uk.gegc.planconfigurator.features.catalog.application;

/**
 * Refreshes the component catalog from the billing backend.
 */
public interface CatalogSyncService {

    /**
     * Replaces the catalog with the backend's current components.
     * <p>
     * Leaves the catalog unchanged when the backend returns nothing usable.
     *
     * @return number of offers now in the catalog, or {@code 0} when the sync was skipped
     */
    int syncOffers();
}
