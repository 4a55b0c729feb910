package com.resellerhub.credits.controller;

import com.resellerhub.credits.model.Actor;
import com.resellerhub.credits.model.LedgerEntry;
import com.resellerhub.credits.model.PlatformSummary;
import com.resellerhub.credits.model.Role;
import com.resellerhub.credits.model.SortDirection;
import com.resellerhub.credits.model.dto.IssueRequest;
import com.resellerhub.credits.model.dto.LedgerPage;
import com.resellerhub.credits.model.dto.TransferRequest;
import com.resellerhub.credits.model.dto.TransferResponse;
import com.resellerhub.credits.service.AggregationService;
import com.resellerhub.credits.service.IssueCommand;
import com.resellerhub.credits.service.TransferCommand;
import com.resellerhub.credits.service.TransferEngine;
import com.resellerhub.credits.service.TransferResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class TransferController {

    private final TransferEngine transferEngine;
    private final AggregationService aggregationService;

    /**
     * POST /api/v1/transfers
     *
     * Moves credit from a reseller to one of its business owners.
     *
     * Optional header: Idempotency-Key (client-generated). A retry with the same key
     * returns the original entry instead of moving credit twice.
     * Returns 201 if new, 200 if idempotent replay.
     */
    @PostMapping("/transfers")
    public ResponseEntity<TransferResponse> createTransfer(
            @RequestHeader(ActorHeaders.ACTOR_ID) long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) Role actorRole,
            @RequestHeader(value = ActorHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody TransferRequest req) {

        TransferResult result = transferEngine.transfer(new Actor(actorId, actorRole), TransferCommand.builder()
                .fromAccountId(req.getFromAccountId())
                .toAccountId(req.getToAccountId())
                .amount(req.getAmount())
                .note(req.getNote())
                .idempotencyKey(idempotencyKey)
                .build());
        return respond(result);
    }

    /**
     * GET /api/v1/transfers/{id}
     */
    @GetMapping("/transfers/{id}")
    public ResponseEntity<LedgerEntry> getTransfer(@PathVariable("id") long entryId) {
        return ResponseEntity.ok(aggregationService.getEntry(entryId));
    }

    /**
     * GET /api/v1/transfers?cursor=&limit=&direction=ASC
     * Platform-wide history, cursor-paginated on entry id.
     */
    @GetMapping("/transfers")
    public ResponseEntity<LedgerPage> listTransfers(
            @RequestParam(value = "cursor", required = false) Long cursor,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "direction", defaultValue = "ASC") SortDirection direction) {

        return ResponseEntity.ok(aggregationService.listAll(cursor, limit, direction));
    }

    /**
     * POST /api/v1/issuances
     *
     * Mints credit into a reseller. Administrators only.
     * Returns 201 if new, 200 if idempotent replay.
     */
    @PostMapping("/issuances")
    public ResponseEntity<TransferResponse> issueCredits(
            @RequestHeader(ActorHeaders.ACTOR_ID) long actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) Role actorRole,
            @RequestHeader(value = ActorHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody IssueRequest req) {

        TransferResult result = transferEngine.issue(new Actor(actorId, actorRole), IssueCommand.builder()
                .toAccountId(req.getToAccountId())
                .amount(req.getAmount())
                .note(req.getNote())
                .idempotencyKey(idempotencyKey)
                .build());
        return respond(result);
    }

    /**
     * GET /api/v1/summary
     */
    @GetMapping("/summary")
    public ResponseEntity<PlatformSummary> getPlatformSummary() {
        return ResponseEntity.ok(aggregationService.platformSummary());
    }

    private static ResponseEntity<TransferResponse> respond(TransferResult result) {
        return ResponseEntity
                .status(result.isIdempotent() ? HttpStatus.OK : HttpStatus.CREATED)
                .body(new TransferResponse(result.getEntry(), result.isIdempotent()));
    }
}
