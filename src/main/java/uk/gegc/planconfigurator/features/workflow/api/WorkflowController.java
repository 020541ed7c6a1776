package uk.gegc.planconfigurator.features.workflow.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.planconfigurator.features.plan.application.PlanService;
import uk.gegc.planconfigurator.features.workflow.api.dto.UpdateFieldRequest;
import uk.gegc.planconfigurator.features.workflow.application.AdvanceResult;
import uk.gegc.planconfigurator.features.workflow.application.WorkflowEngine;
import uk.gegc.planconfigurator.features.workflow.application.WorkflowView;
import uk.gegc.planconfigurator.shared.api.BearerTokens;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/v1/plan-workflows/{sessionId}")
@RequiredArgsConstructor
@Tag(name = "Plan workflow", description = "Step-by-step configuration of a subscription plan")
public class WorkflowController {

    private final WorkflowEngine workflowEngine;
    private final PlanService planService;

    @Operation(summary = "Get the current view of a workflow session")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session view",
                    content = @Content(schema = @Schema(implementation = WorkflowView.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping
    public WorkflowView view(@PathVariable String sessionId) {
        return workflowEngine.view(sessionId);
    }

    @Operation(summary = "Start or resume a workflow session",
            description = "Creates the session when it does not exist and enters the first visible step")
    @PostMapping("/start")
    public WorkflowView start(@PathVariable String sessionId) {
        return workflowEngine.start(sessionId);
    }

    @Operation(summary = "Validate the current step and advance",
            description = "Runs local rules and server checks. A blocked advance returns the validation report; "
                    + "a superseded one is dropped and returns the current view.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Advance outcome",
                    content = @Content(schema = @Schema(implementation = AdvanceResult.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/advance")
    public CompletableFuture<AdvanceResult> advance(
            @PathVariable String sessionId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return workflowEngine.advance(sessionId, BearerTokens.fromHeader(authorization));
    }

    @Operation(summary = "Go back to the previous step, keeping entered data")
    @PostMapping("/back")
    public WorkflowView back(@PathVariable String sessionId) {
        return workflowEngine.back(sessionId);
    }

    @Operation(summary = "Reset the session to not started")
    @PostMapping("/reset")
    public WorkflowView reset(@PathVariable String sessionId) {
        return workflowEngine.reset(sessionId);
    }

    @Operation(summary = "Set the value of a field",
            description = "Validates the field locally and recomputes the price summary")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated view",
                    content = @Content(schema = @Schema(implementation = WorkflowView.class))),
            @ApiResponse(responseCode = "400", description = "Unknown step or field",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PutMapping("/steps/{stepId}/fields/{fieldId}")
    public WorkflowView updateField(
            @PathVariable String sessionId,
            @Parameter(description = "Step id", example = "base-plan") @PathVariable String stepId,
            @Parameter(description = "Field id", example = "tier") @PathVariable String fieldId,
            @RequestBody UpdateFieldRequest request) {
        return workflowEngine.updateField(sessionId, stepId, fieldId, request.value());
    }

    @Operation(summary = "Clear the values of one step")
    @PostMapping("/steps/{stepId}/reset")
    public WorkflowView resetStep(@PathVariable String sessionId, @PathVariable String stepId) {
        return workflowEngine.resetStep(sessionId, stepId);
    }

    @Operation(summary = "Quote the current selection with the billing backend")
    @PostMapping("/quote")
    public CompletableFuture<Map<String, Object>> quote(
            @PathVariable String sessionId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return planService.quote(sessionId, BearerTokens.fromHeader(authorization));
    }

    @Operation(summary = "Create the plan from a completed session")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Plan created"),
            @ApiResponse(responseCode = "409", description = "Session not completed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Backend rejected the plan",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/submit")
    public CompletableFuture<ResponseEntity<Map<String, Object>>> submit(
            @PathVariable String sessionId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return planService.submit(sessionId, BearerTokens.fromHeader(authorization))
                .thenApply(plan -> ResponseEntity.status(HttpStatus.CREATED).body(plan));
    }
}
