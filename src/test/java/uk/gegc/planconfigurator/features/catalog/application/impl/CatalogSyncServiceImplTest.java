package uk.gegc.planconfigurator.features.catalog.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.planconfigurator.features.backend.application.BackendClient;
import uk.gegc.planconfigurator.features.backend.application.BackendProperties;
import uk.gegc.planconfigurator.features.backend.domain.exception.NetworkException;
import uk.gegc.planconfigurator.features.backend.domain.model.ErrorEnvelope;
import uk.gegc.planconfigurator.features.backend.domain.model.ErrorKind;
import uk.gegc.planconfigurator.features.backend.domain.model.OperationParams;
import uk.gegc.planconfigurator.features.backend.domain.model.ResponseEnvelope;
import uk.gegc.planconfigurator.features.backend.infra.config.BackendEndpointCatalog;
import uk.gegc.planconfigurator.features.catalog.application.CatalogProperties;
import uk.gegc.planconfigurator.features.catalog.application.ComponentCatalog;
import uk.gegc.planconfigurator.features.catalog.domain.model.ComponentOffer;
import uk.gegc.planconfigurator.features.pricing.application.PricingProperties;
import uk.gegc.planconfigurator.features.pricing.domain.model.ComponentKind;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CatalogSyncServiceImpl")
class CatalogSyncServiceImplTest {

    @Mock
    private BackendClient backendClient;

    private BackendProperties backendProperties;
    private ComponentCatalog componentCatalog;
    private CatalogSyncServiceImpl service;

    @BeforeEach
    void setUp() {
        backendProperties = new BackendProperties();
        backendProperties.setServiceToken("svc-token");

        CatalogProperties.Offer seed = new CatalogProperties.Offer();
        seed.setCode("basic");
        seed.setName("Basic");
        seed.setKind(ComponentKind.RECURRING);
        seed.setUnitPrice(new BigDecimal("20"));
        CatalogProperties catalogProperties = new CatalogProperties();
        catalogProperties.setOffers(List.of(seed));
        componentCatalog = new ComponentCatalog(catalogProperties);

        service = new CatalogSyncServiceImpl(backendClient, backendProperties, catalogProperties,
                new PricingProperties(), componentCatalog);
    }

    private void backendReturns(List<Map<String, Object>> items) {
        when(backendClient.call(eq(BackendEndpointCatalog.CATALOG_COMPONENTS), any(OperationParams.class), eq("svc-token")))
                .thenReturn(CompletableFuture.completedFuture(new ResponseEnvelope(200, Map.of("items", items), null)));
    }

    private static Map<String, Object> item(String code, String kind, String price, String currency, boolean prorate) {
        return Map.of("code", code, "name", code.toUpperCase(), "kind", kind,
                "unitPrice", new BigDecimal(price), "currency", currency, "prorationEligible", prorate);
    }

    @Test
    @DisplayName("replaces the catalog with active backend components")
    void replacesCatalog() {
        backendReturns(List.of(
                item("pro", "recurring", "55.00", "USD", true),
                item("setup-standard", "one_time", "60.00", "usd", true)));

        int synced = service.syncOffers();

        assertThat(synced).isEqualTo(2);
        assertThat(componentCatalog.find("basic")).isEmpty();
        assertThat(componentCatalog.find("pro")).hasValueSatisfying(offer -> {
            assertThat(offer.unitPrice()).isEqualByComparingTo("55.00");
            assertThat(offer.prorationEligible()).isTrue();
        });
        // one-time charges are never prorated
        assertThat(componentCatalog.find("setup-standard")).map(ComponentOffer::prorationEligible).contains(false);

        ArgumentCaptor<OperationParams> params = ArgumentCaptor.forClass(OperationParams.class);
        verify(backendClient).call(eq(BackendEndpointCatalog.CATALOG_COMPONENTS), params.capture(), anyString());
        assertThat(params.getValue().filters()).containsEntry("status", "active");
        assertThat(params.getValue().limit()).isEqualTo(200);
    }

    @Test
    @DisplayName("skips components in another currency or with an unknown kind")
    void skipsUnusable() {
        backendReturns(List.of(
                item("pro", "recurring", "55.00", "EUR", false),
                item("weird", "lifetime", "1.00", "USD", false),
                item("addon-sso", "recurring", "15.00", "USD", false)));

        assertThat(service.syncOffers()).isEqualTo(1);
        assertThat(componentCatalog.all()).extracting(ComponentOffer::code).containsExactly("addon-sso");
    }

    @Test
    @DisplayName("skips components with a negative price and syncs the rest")
    void skipsNegativePrice() {
        backendReturns(List.of(
                item("discount-hack", "recurring", "-5.00", "USD", false),
                item("pro", "recurring", "55.00", "USD", false)));

        assertThat(service.syncOffers()).isEqualTo(1);
        assertThat(componentCatalog.all()).extracting(ComponentOffer::code).containsExactly("pro");
    }

    @Test
    @DisplayName("keeps existing offers when every component has a negative price")
    void keepsOffersWhenAllPricesNegative() {
        backendReturns(List.of(item("discount-hack", "recurring", "-5.00", "USD", false)));

        assertThat(service.syncOffers()).isZero();
        assertThat(componentCatalog.find("basic")).isPresent();
    }

    @Test
    @DisplayName("keeps existing offers when the backend returns nothing usable")
    void keepsOffersOnEmpty() {
        backendReturns(List.of());

        assertThat(service.syncOffers()).isZero();
        assertThat(componentCatalog.find("basic")).isPresent();
    }

    @Test
    @DisplayName("does nothing without a service token")
    void noToken() {
        backendProperties.setServiceToken(" ");

        assertThat(service.syncOffers()).isZero();
        verifyNoInteractions(backendClient);
    }

    @Test
    @DisplayName("backend failures surface unwrapped and leave the catalog intact")
    void backendFailure() {
        when(backendClient.call(eq(BackendEndpointCatalog.CATALOG_COMPONENTS), any(OperationParams.class), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new NetworkException(BackendEndpointCatalog.CATALOG_COMPONENTS,
                        ErrorEnvelope.of(ErrorKind.NETWORK, "Connection refused"), 4, null)));

        assertThatThrownBy(() -> service.syncOffers()).isInstanceOf(NetworkException.class);
        assertThat(componentCatalog.find("basic")).isPresent();
    }
}
