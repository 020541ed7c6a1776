package uk.gegc.planconfigurator.features.plan.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.planconfigurator.features.backend.domain.model.BinaryPayload;
import uk.gegc.planconfigurator.features.plan.api.dto.RenamePlanRequest;
import uk.gegc.planconfigurator.features.plan.application.PlanService;
import uk.gegc.planconfigurator.shared.api.BearerTokens;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
@Tag(name = "Plans", description = "Existing subscription plans held by the billing backend")
public class PlanController {

    private final PlanService planService;

    @Operation(summary = "List the plans of an account")
    @GetMapping("/accounts/{accountId}/plans")
    public CompletableFuture<Map<String, Object>> listPlans(
            @PathVariable String accountId,
            @Parameter(description = "Page size") @RequestParam(required = false) @Min(1) @Max(100) Integer limit,
            @Parameter(description = "Plan status filter", example = "active") @RequestParam(required = false) String status,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return planService.listPlans(accountId, limit, status, BearerTokens.fromHeader(authorization));
    }

    @Operation(summary = "Get a plan")
    @GetMapping("/plans/{planId}")
    public CompletableFuture<Map<String, Object>> getPlan(
            @PathVariable String planId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return planService.getPlan(planId, BearerTokens.fromHeader(authorization));
    }

    @Operation(summary = "Rename a plan")
    @PatchMapping("/plans/{planId}")
    public CompletableFuture<Map<String, Object>> renamePlan(
            @PathVariable String planId,
            @Valid @RequestBody RenamePlanRequest request,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return planService.renamePlan(planId, request.planName(), BearerTokens.fromHeader(authorization));
    }

    @Operation(summary = "Delete a plan")
    @DeleteMapping("/plans/{planId}")
    public CompletableFuture<ResponseEntity<Void>> deletePlan(
            @PathVariable String planId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return planService.deletePlan(planId, BearerTokens.fromHeader(authorization))
                .thenApply(ignored -> ResponseEntity.noContent().build());
    }

    @Operation(summary = "Attach a document to a plan", description = "Forwarded to the backend as multipart form data")
    @PostMapping(value = "/plans/{planId}/attachments", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public CompletableFuture<ResponseEntity<Map<String, Object>>> attach(
            @PathVariable String planId,
            @RequestPart("file") MultipartFile file,
            @RequestPart(value = "description", required = false) String description,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        BinaryPayload payload = new BinaryPayload(
                file.getOriginalFilename() != null ? file.getOriginalFilename() : "attachment",
                file.getContentType(),
                readBytes(file));
        return planService.attach(planId, payload, description, BearerTokens.fromHeader(authorization))
                .thenApply(attachment -> ResponseEntity.status(HttpStatus.CREATED).body(attachment));
    }

    private static byte[] readBytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read uploaded file " + file.getOriginalFilename(), e);
        }
    }
}
