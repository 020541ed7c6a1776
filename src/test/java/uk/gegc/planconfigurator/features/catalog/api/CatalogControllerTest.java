package uk.gegc.planconfigurator.features.catalog.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.planconfigurator.features.catalog.application.ComponentCatalog;
import uk.gegc.planconfigurator.features.catalog.domain.model.ComponentOffer;
import uk.gegc.planconfigurator.features.pricing.domain.model.ComponentKind;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CatalogController.class)
@DisplayName("CatalogController")
class CatalogControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ComponentCatalog componentCatalog;

    @Test
    @DisplayName("GET /catalog/offers lists offers with exact prices")
    void listOffers() throws Exception {
        when(componentCatalog.all()).thenReturn(List.of(
                new ComponentOffer("pro", "Pro tier", ComponentKind.RECURRING, new BigDecimal("49.00"), true),
                new ComponentOffer("setup-standard", "Standard setup", ComponentKind.ONE_TIME, new BigDecimal("50.00"), false)));

        mockMvc.perform(get("/api/v1/catalog/offers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].code").value("pro"))
                .andExpect(jsonPath("$[0].kind").value("RECURRING"))
                .andExpect(jsonPath("$[0].unitPrice").value(49.00))
                .andExpect(jsonPath("$[1].prorationEligible").value(false));
    }
}
