package uk.gegc.planconfigurator.features.account.application;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Read-only lookups of billing accounts and their addresses.
 */
public interface AccountDirectoryService {

    CompletableFuture<Map<String, Object>> searchAccounts(String query, Integer limit, String sort, String authToken);

    CompletableFuture<Map<String, Object>> getAccount(String accountId, String authToken);

    CompletableFuture<Map<String, Object>> listAddresses(String accountId, Integer limit, String authToken);

    CompletableFuture<Map<String, Object>> getAddress(String accountId, String addressId, String authToken);
}
