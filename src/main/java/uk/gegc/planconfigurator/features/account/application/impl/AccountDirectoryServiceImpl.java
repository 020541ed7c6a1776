package uk.gegc.planconfigurator.features.account.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.planconfigurator.features.account.application.AccountDirectoryService;
import uk.gegc.planconfigurator.features.backend.application.BackendClient;
import uk.gegc.planconfigurator.features.backend.domain.model.OperationParams;
import uk.gegc.planconfigurator.features.backend.domain.model.ResponseEnvelope;
import uk.gegc.planconfigurator.features.backend.infra.config.BackendEndpointCatalog;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Service
@RequiredArgsConstructor
public class AccountDirectoryServiceImpl implements AccountDirectoryService {

    private final BackendClient backendClient;

    @Override
    public CompletableFuture<Map<String, Object>> searchAccounts(String query, Integer limit, String sort, String authToken) {
        OperationParams.OperationParamsBuilder params = OperationParams.builder()
                .limit(limit)
                .sort(sort);
        if (query != null && !query.isBlank()) {
            params.filter("q", query.trim());
        }
        return backendClient.call(BackendEndpointCatalog.ACCOUNTS, params.build(), authToken)
                .thenApply(ResponseEnvelope::data);
    }

    @Override
    public CompletableFuture<Map<String, Object>> getAccount(String accountId, String authToken) {
        return backendClient.call(BackendEndpointCatalog.ACCOUNT, OperationParams.ofId(accountId), authToken)
                .thenApply(ResponseEnvelope::data);
    }

    @Override
    public CompletableFuture<Map<String, Object>> listAddresses(String accountId, Integer limit, String authToken) {
        OperationParams params = OperationParams.builder().id(accountId).limit(limit).build();
        return backendClient.call(BackendEndpointCatalog.ADDRESSES, params, authToken)
                .thenApply(ResponseEnvelope::data);
    }

    @Override
    public CompletableFuture<Map<String, Object>> getAddress(String accountId, String addressId, String authToken) {
        OperationParams params = OperationParams.builder().id(accountId).secondaryId(addressId).build();
        return backendClient.call(BackendEndpointCatalog.ADDRESS, params, authToken)
                .thenApply(ResponseEnvelope::data);
    }
}
