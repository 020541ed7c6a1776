package uk.gegc.planconfigurator.features.plan.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.planconfigurator.features.backend.application.BackendClient;
import uk.gegc.planconfigurator.features.backend.domain.model.BinaryPayload;
import uk.gegc.planconfigurator.features.backend.domain.model.OperationParams;
import uk.gegc.planconfigurator.features.backend.domain.model.ResponseEnvelope;
import uk.gegc.planconfigurator.features.backend.infra.config.BackendEndpointCatalog;
import uk.gegc.planconfigurator.features.plan.application.PlanService;
import uk.gegc.planconfigurator.features.pricing.application.PricingProperties;
import uk.gegc.planconfigurator.features.pricing.domain.model.Component;
import uk.gegc.planconfigurator.features.pricing.domain.model.Discount;
import uk.gegc.planconfigurator.features.pricing.domain.model.Selection;
import uk.gegc.planconfigurator.features.workflow.application.WorkflowEngine;
import uk.gegc.planconfigurator.features.workflow.domain.exception.WorkflowStateConflictException;
import uk.gegc.planconfigurator.features.workflow.domain.model.WorkflowState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlanServiceImpl implements PlanService {

    private final BackendClient backendClient;
    private final WorkflowEngine workflowEngine;
    private final PricingProperties pricingProperties;

    @Override
    public CompletableFuture<Map<String, Object>> submit(String sessionId, String authToken) {
        WorkflowState state = workflowEngine.state(sessionId);
        if (!state.isCompleted()) {
            throw new WorkflowStateConflictException(
                    "Workflow session " + sessionId + " must be completed before the plan can be submitted");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("accountId", state.fieldValues().get("accountId"));
        body.put("planName", state.fieldValues().get("planName"));
        body.put("currency", pricingProperties.getCurrency());
        body.putAll(selectionBody(state.selection()));

        log.info("Submitting plan for session {} with {} line item(s)",
                sessionId, state.selection().components().size());
        return backendClient.call(BackendEndpointCatalog.CREATE_PLAN,
                        OperationParams.ofId(String.valueOf(state.fieldValues().get("accountId"))), body, authToken)
                .thenApply(response -> {
                    log.info("Plan {} created for session {}", response.data().get("planId"), sessionId);
                    return response.data();
                });
    }

    @Override
    public CompletableFuture<Map<String, Object>> quote(String sessionId, String authToken) {
        WorkflowState state = workflowEngine.state(sessionId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("currency", pricingProperties.getCurrency());
        body.putAll(selectionBody(state.selection()));

        return backendClient.call(BackendEndpointCatalog.PRICE_QUOTE, OperationParams.none(), body, authToken)
                .thenApply(ResponseEnvelope::data);
    }

    @Override
    public CompletableFuture<Map<String, Object>> listPlans(String accountId, Integer limit, String status, String authToken) {
        OperationParams.OperationParamsBuilder params = OperationParams.builder()
                .id(accountId)
                .limit(limit);
        if (status != null && !status.isBlank()) {
            params.filter("status", status);
        }
        return backendClient.call(BackendEndpointCatalog.PLANS, params.build(), authToken)
                .thenApply(ResponseEnvelope::data);
    }

    @Override
    public CompletableFuture<Map<String, Object>> getPlan(String planId, String authToken) {
        return backendClient.call(BackendEndpointCatalog.PLAN, OperationParams.ofId(planId), authToken)
                .thenApply(ResponseEnvelope::data);
    }

    @Override
    public CompletableFuture<Map<String, Object>> renamePlan(String planId, String planName, String authToken) {
        return backendClient.call(BackendEndpointCatalog.UPDATE_PLAN, OperationParams.ofId(planId),
                        Map.of("planName", planName), authToken)
                .thenApply(ResponseEnvelope::data);
    }

    @Override
    public CompletableFuture<Void> deletePlan(String planId, String authToken) {
        return backendClient.call(BackendEndpointCatalog.DELETE_PLAN, OperationParams.ofId(planId), authToken)
                .thenAccept(response -> log.info("Plan {} deleted", planId));
    }

    @Override
    public CompletableFuture<Map<String, Object>> attach(String planId, BinaryPayload file, String description,
                                                         String authToken) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("file", file);
        if (description != null && !description.isBlank()) {
            body.put("description", description);
        }
        return backendClient.call(BackendEndpointCatalog.PLAN_ATTACHMENT, OperationParams.ofId(planId), body, authToken)
                .thenApply(ResponseEnvelope::data);
    }

    private static Map<String, Object> selectionBody(Selection selection) {
        List<Map<String, Object>> lineItems = selection.components().stream()
                .map(PlanServiceImpl::lineItem)
                .toList();
        List<Map<String, Object>> promotions = selection.discounts().stream()
                .map(Discount::code)
                .distinct()
                .map(code -> Map.<String, Object>of("code", code))
                .toList();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("lineItems", lineItems);
        if (!promotions.isEmpty()) {
            body.put("promotions", promotions);
        }
        return body;
    }

    private static Map<String, Object> lineItem(Component component) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("code", component.code());
        item.put("kind", component.kind().wireValue());
        item.put("quantity", component.quantity());
        item.put("unitPrice", component.unitPrice());
        return item;
    }
}
