package com.resellerhub.credits.controller;

import com.resellerhub.credits.model.Account;
import com.resellerhub.credits.model.AccountStats;
import com.resellerhub.credits.model.LedgerQuery;
import com.resellerhub.credits.model.Reconciliation;
import com.resellerhub.credits.model.Role;
import com.resellerhub.credits.model.SortDirection;
import com.resellerhub.credits.model.dto.BalanceResponse;
import com.resellerhub.credits.model.dto.CreateAccountRequest;
import com.resellerhub.credits.model.dto.LedgerPage;
import com.resellerhub.credits.service.AccountService;
import com.resellerhub.credits.service.AggregationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;
    private final AggregationService aggregationService;

    /**
     * GET /health
     * Liveness check, 200 while the service is running.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * GET /api/v1/accounts?role=BUSINESS_OWNER&owning_reseller_id=1
     */
    @GetMapping("/api/v1/accounts")
    public ResponseEntity<List<Account>> listAccounts(
            @RequestParam(value = "role", required = false) Role role,
            @RequestParam(value = "owning_reseller_id", required = false) Long owningResellerId) {
        return ResponseEntity.ok(accountService.list(role, owningResellerId));
    }

    /**
     * POST /api/v1/accounts
     * Provisions a reseller or business owner account with a zero balance.
     */
    @PostMapping("/api/v1/accounts")
    public ResponseEntity<Account> createAccount(@Valid @RequestBody CreateAccountRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(accountService.provision(req));
    }

    @GetMapping("/api/v1/accounts/{id}")
    public ResponseEntity<Account> getAccount(@PathVariable("id") long accountId) {
        return ResponseEntity.ok(accountService.resolve(accountId));
    }

    /**
     * DELETE /api/v1/accounts/{id}
     * Soft delete; balance and history are retained.
     */
    @DeleteMapping("/api/v1/accounts/{id}")
    public ResponseEntity<Account> deactivateAccount(@PathVariable("id") long accountId) {
        return ResponseEntity.ok(accountService.deactivate(accountId));
    }

    @GetMapping("/api/v1/accounts/{id}/balance")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("id") long accountId) {
        return ResponseEntity.ok(new BalanceResponse(accountId, accountService.getBalance(accountId)));
    }

    /**
     * GET /api/v1/accounts/{id}/transfers?from=&to=&counterpart_role=&cursor=&limit=&direction=
     * Entries where the account is sender or receiver, oldest first unless direction=DESC.
     */
    @GetMapping("/api/v1/accounts/{id}/transfers")
    public ResponseEntity<LedgerPage> listTransfersForAccount(
            @PathVariable("id") long accountId,
            @RequestParam(value = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @RequestParam(value = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to,
            @RequestParam(value = "counterpart_role", required = false) Role counterpartRole,
            @RequestParam(value = "cursor", required = false) Long cursor,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "direction", defaultValue = "ASC") SortDirection direction) {

        LedgerQuery query = LedgerQuery.builder()
                .accountId(accountId)
                .from(from)
                .to(to)
                .counterpartRole(counterpartRole)
                .cursor(cursor)
                .limit(limit)
                .direction(direction)
                .build();
        return ResponseEntity.ok(aggregationService.listForAccount(query));
    }

    @GetMapping("/api/v1/accounts/{id}/stats")
    public ResponseEntity<AccountStats> getAccountStats(@PathVariable("id") long accountId) {
        return ResponseEntity.ok(aggregationService.statsForAccount(accountId));
    }

    /**
     * GET /api/v1/accounts/{id}/reconciliation
     * Compares the stored balance with the net of every ledger entry touching the account.
     */
    @GetMapping("/api/v1/accounts/{id}/reconciliation")
    public ResponseEntity<Reconciliation> reconcile(@PathVariable("id") long accountId) {
        return ResponseEntity.ok(aggregationService.reconcile(accountId));
    }
}
