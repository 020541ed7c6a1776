package uk.gegc.planconfigurator.features.account.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import uk.gegc.planconfigurator.features.account.application.AccountDirectoryService;
import uk.gegc.planconfigurator.features.backend.domain.exception.AuthenticationRequiredException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AccountDirectoryController.class)
@DisplayName("AccountDirectoryController")
class AccountDirectoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AccountDirectoryService accountDirectoryService;

    @Test
    @DisplayName("GET /accounts searches with query, page size and sort")
    void search() throws Exception {
        when(accountDirectoryService.searchAccounts("acme", 10, "display_name", "abc"))
                .thenReturn(CompletableFuture.completedFuture(Map.of(
                        "items", List.of(Map.of("accountId", "acc_1", "name", "Acme")),
                        "totalCount", 1L)));

        MvcResult async = mockMvc.perform(get("/api/v1/accounts")
                        .param("q", "acme")
                        .param("limit", "10")
                        .param("sort", "display_name")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer abc"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(async))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].accountId").value("acc_1"))
                .andExpect(jsonPath("$.totalCount").value(1));
    }

    @Test
    @DisplayName("GET /accounts/{id}/addresses/{addressId} returns one address")
    void address() throws Exception {
        when(accountDirectoryService.getAddress("acc_1", "adr_9", "abc"))
                .thenReturn(CompletableFuture.completedFuture(Map.of("addressId", "adr_9", "city", "Leeds")));

        MvcResult async = mockMvc.perform(get("/api/v1/accounts/acc_1/addresses/adr_9")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer abc"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(async))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.city").value("Leeds"));
    }

    @Test
    @DisplayName("missing token is a 401 with a bearer challenge")
    void unauthenticated() throws Exception {
        when(accountDirectoryService.getAccount("acc_1", null))
                .thenReturn(CompletableFuture.failedFuture(new AuthenticationRequiredException("account")));

        MvcResult async = mockMvc.perform(get("/api/v1/accounts/acc_1"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(async))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"));
    }
}
