package uk.gegc.planconfigurator.features.account.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.planconfigurator.features.account.application.AccountDirectoryService;
import uk.gegc.planconfigurator.shared.api.BearerTokens;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
@Validated
@Tag(name = "Accounts", description = "Billing account lookups used to pick the plan owner")
public class AccountDirectoryController {

    private final AccountDirectoryService accountDirectoryService;

    @Operation(summary = "Search accounts")
    @GetMapping
    public CompletableFuture<Map<String, Object>> searchAccounts(
            @Parameter(description = "Free text query") @RequestParam(required = false) String q,
            @RequestParam(required = false) @Min(1) @Max(100) Integer limit,
            @Parameter(description = "Backend sort key", example = "display_name") @RequestParam(required = false) String sort,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return accountDirectoryService.searchAccounts(q, limit, sort, BearerTokens.fromHeader(authorization));
    }

    @Operation(summary = "Get an account")
    @GetMapping("/{accountId}")
    public CompletableFuture<Map<String, Object>> getAccount(
            @PathVariable String accountId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return accountDirectoryService.getAccount(accountId, BearerTokens.fromHeader(authorization));
    }

    @Operation(summary = "List the addresses of an account")
    @GetMapping("/{accountId}/addresses")
    public CompletableFuture<Map<String, Object>> listAddresses(
            @PathVariable String accountId,
            @RequestParam(required = false) @Min(1) @Max(100) Integer limit,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return accountDirectoryService.listAddresses(accountId, limit, BearerTokens.fromHeader(authorization));
    }

    @Operation(summary = "Get an address of an account")
    @GetMapping("/{accountId}/addresses/{addressId}")
    public CompletableFuture<Map<String, Object>> getAddress(
            @PathVariable String accountId,
            @PathVariable String addressId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return accountDirectoryService.getAddress(accountId, addressId, BearerTokens.fromHeader(authorization));
    }
}
