package com.resellerhub.credits.service;

import com.resellerhub.credits.config.LedgerProperties;
import com.resellerhub.credits.exception.AccountNotFoundException;
import com.resellerhub.credits.exception.LedgerEntryNotFoundException;
import com.resellerhub.credits.model.Account;
import com.resellerhub.credits.model.AccountStats;
import com.resellerhub.credits.model.LedgerEntry;
import com.resellerhub.credits.model.LedgerQuery;
import com.resellerhub.credits.model.PlatformSummary;
import com.resellerhub.credits.model.Reconciliation;
import com.resellerhub.credits.model.Role;
import com.resellerhub.credits.model.SortDirection;
import com.resellerhub.credits.model.dto.LedgerPage;
import com.resellerhub.credits.repository.AccountRepository;
import com.resellerhub.credits.repository.LedgerRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read-only views over the ledger: history pages, per-account statistics,
 * the platform summary and reconciliation.
 *
 * Nothing here is cached. Methods that combine several queries run in one
 * REPEATABLE_READ transaction, so balances and entry aggregates come from the
 * same snapshot and never straddle a concurrent commit.
 */
@Service
@RequiredArgsConstructor
public class AggregationService {

    private final AccountRepository accountRepo;
    private final LedgerRepository ledgerRepo;
    private final LedgerProperties properties;

    // =========================================================================
    // HISTORY
    // =========================================================================

    @Transactional(readOnly = true)
    public LedgerEntry getEntry(long entryId) {
        return ledgerRepo.findById(entryId)
                .orElseThrow(() -> new LedgerEntryNotFoundException(entryId));
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public LedgerPage listForAccount(LedgerQuery query) {
        requireAccount(query.getAccountId());
        int limit = properties.getPagination().clamp(query.getLimit());
        // One extra row tells us whether another page exists.
        return toPage(ledgerRepo.findForAccount(query, limit + 1), limit);
    }

    @Transactional(readOnly = true)
    public LedgerPage listAll(Long cursor, Integer requestedLimit, SortDirection direction) {
        int limit = properties.getPagination().clamp(requestedLimit);
        return toPage(ledgerRepo.findAll(cursor, direction, limit + 1), limit);
    }

    // =========================================================================
    // STATISTICS
    // =========================================================================

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public AccountStats statsForAccount(long accountId) {
        Account account = requireAccount(accountId);
        return ledgerRepo.statsFor(accountId)
                .role(account.getRole())
                .currentBalance(account.getBalance())
                .ownedBusinessOwners(account.getRole() == Role.RESELLER
                        ? accountRepo.countBusinessOwners(accountId)
                        : null)
                .build();
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public PlatformSummary platformSummary() {
        PlatformSummary.PlatformSummaryBuilder summary = ledgerRepo.platformTotals();
        PlatformSummary totals = summary.build();
        double average = totals.getTotalTransfers() == 0
                ? 0.0
                : (double) totals.getTotalVolume() / totals.getTotalTransfers();
        return summary
                .totalInCirculation(accountRepo.sumBalances())
                .averageTransfer(average)
                .perResellerBreakdown(ledgerRepo.resellerBreakdown())
                .build();
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Reconciliation reconcile(long accountId) {
        Account account = requireAccount(accountId);
        AccountStats ledgerSide = ledgerRepo.statsFor(accountId).build();
        return new Reconciliation(accountId, account.getBalance(),
                ledgerSide.getTotalReceived() - ledgerSide.getTotalSent());
    }

    private Account requireAccount(long accountId) {
        return accountRepo.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    private static LedgerPage toPage(List<LedgerEntry> fetched, int limit) {
        boolean hasMore = fetched.size() > limit;
        List<LedgerEntry> entries = hasMore ? fetched.subList(0, limit) : fetched;
        Long nextCursor = entries.isEmpty() ? null : entries.get(entries.size() - 1).getId();
        return new LedgerPage(List.copyOf(entries), nextCursor, hasMore);
    }
}
