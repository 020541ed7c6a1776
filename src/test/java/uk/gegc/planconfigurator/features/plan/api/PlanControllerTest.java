package uk.gegc.planconfigurator.features.plan.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import uk.gegc.planconfigurator.features.backend.domain.model.BinaryPayload;
import uk.gegc.planconfigurator.features.plan.application.PlanService;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PlanController.class)
@DisplayName("PlanController")
class PlanControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PlanService planService;

    @Test
    @DisplayName("GET /accounts/{id}/plans passes paging and status through")
    void listPlans() throws Exception {
        when(planService.listPlans("acc_1234", 20, "active", "abc"))
                .thenReturn(CompletableFuture.completedFuture(Map.of("items", List.of(Map.of("planId", "pln_1")))));

        MvcResult async = mockMvc.perform(get("/api/v1/accounts/acc_1234/plans")
                        .param("limit", "20")
                        .param("status", "active")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer abc"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(async))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].planId").value("pln_1"));
    }

    @Test
    @DisplayName("page size above the maximum is rejected before calling the backend")
    void limitTooLarge() throws Exception {
        mockMvc.perform(get("/api/v1/accounts/acc_1234/plans").param("limit", "1000"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(planService);
    }

    @Test
    @DisplayName("PATCH /plans/{id} requires a plan name")
    void renameValidation() throws Exception {
        mockMvc.perform(patch("/api/v1/plans/pln_1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"planName\": \"\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(planService);
    }

    @Test
    @DisplayName("DELETE /plans/{id} answers 204")
    void deletePlan() throws Exception {
        when(planService.deletePlan("pln_1", null)).thenReturn(CompletableFuture.completedFuture(null));

        MvcResult async = mockMvc.perform(delete("/api/v1/plans/pln_1"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(async))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("POST /plans/{id}/attachments forwards the uploaded file")
    void attach() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "contract.pdf", "application/pdf",
                "%PDF-1.7".getBytes(StandardCharsets.US_ASCII));
        MockMultipartFile description = new MockMultipartFile("description", "", "text/plain",
                "Signed contract".getBytes(StandardCharsets.UTF_8));
        when(planService.attach(eq("pln_1"), any(BinaryPayload.class), eq("Signed contract"), anyString()))
                .thenReturn(CompletableFuture.completedFuture(Map.of("attachmentId", "att_1")));

        MvcResult async = mockMvc.perform(multipart("/api/v1/plans/pln_1/attachments")
                        .file(file)
                        .file(description)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer abc"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(async))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.attachmentId").value("att_1"));

        ArgumentCaptor<BinaryPayload> payload = ArgumentCaptor.forClass(BinaryPayload.class);
        verify(planService).attach(eq("pln_1"), payload.capture(), eq("Signed contract"), eq("abc"));
        assertThat(payload.getValue().fileName()).isEqualTo("contract.pdf");
        assertThat(payload.getValue().contentType()).isEqualTo("application/pdf");
        assertThat(payload.getValue().size()).isEqualTo(8);
    }
}
