package com.resellerhub.credits.service;

import com.resellerhub.credits.config.LedgerProperties;
import com.resellerhub.credits.exception.AccountNotFoundException;
import com.resellerhub.credits.exception.CreditLedgerException;
import com.resellerhub.credits.exception.IdempotencyKeyConflictException;
import com.resellerhub.credits.exception.InsufficientFundsException;
import com.resellerhub.credits.exception.InvalidAmountException;
import com.resellerhub.credits.exception.PolicyViolationException;
import com.resellerhub.credits.exception.TransientStoreFailureException;
import com.resellerhub.credits.model.Account;
import com.resellerhub.credits.model.Actor;
import com.resellerhub.credits.model.EntryType;
import com.resellerhub.credits.model.LedgerEntry;
import com.resellerhub.credits.observability.TransferMetrics;
import com.resellerhub.credits.repository.AccountRepository;
import com.resellerhub.credits.repository.LedgerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Executes credit movements: reseller-to-business-owner transfers and administrative issuance.
 *
 * Every movement runs in one explicit transaction scope (READ_COMMITTED, bounded by
 * {@code credit-ledger.transfer.timeout-seconds}):
 *   1. Lock the involved account rows in ascending id order (deadlock prevention)
 *   2. Validate against the locked rows: accounts active, hierarchy policy
 *   3. Replay a previous result if the Idempotency-Key is already recorded
 *   4. Check funds, debit the sender, credit the receiver
 *   5. Append the ledger entry with both post-movement balances
 * Any failure rolls the whole scope back, so balances never change without a matching
 * entry and no entry exists without its balance change.
 *
 * Validation order for a transfer is fixed, first failure wins:
 * amount, accounts, policy, funds.
 *
 * A replay is only served to a caller that passes the policy, and only when the stored
 * entry matches the request exactly: same accounts, amount, actor and recorded note.
 * Anything else under a known key is a key conflict.
 */
@Service
@Slf4j
public class TransferEngine {

    private static final String OVERRIDE_MARKER = "[admin-override by actor %d]";

    private final AccountRepository accountRepo;
    private final LedgerRepository ledgerRepo;
    private final HierarchyPolicy hierarchyPolicy;
    private final TransferMetrics metrics;
    private final TransactionTemplate transactionTemplate;

    public TransferEngine(AccountRepository accountRepo,
                          LedgerRepository ledgerRepo,
                          HierarchyPolicy hierarchyPolicy,
                          TransferMetrics metrics,
                          PlatformTransactionManager transactionManager,
                          LedgerProperties properties) {
        this.accountRepo = accountRepo;
        this.ledgerRepo = ledgerRepo;
        this.hierarchyPolicy = hierarchyPolicy;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setName("credit-movement");
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.transactionTemplate.setTimeout(properties.getTransfer().getTimeoutSeconds());
    }

    // =========================================================================
    // TRANSFER
    // =========================================================================

    public TransferResult transfer(Actor actor, TransferCommand command) {
        long started = System.nanoTime();
        try {
            if (command.getAmount() <= 0) {
                throw new InvalidAmountException(command.getAmount());
            }
            TransferResult result = inTransaction(command.getIdempotencyKey(),
                    () -> executeTransfer(actor, command));
            recordOutcome(EntryType.TRANSFER, result, started);
            return result;
        } catch (CreditLedgerException e) {
            metrics.recordRejected(EntryType.TRANSFER, e.getErrorCode());
            log.warn("Transfer rejected: actor={}, from={}, to={}, amount={}, error={}",
                    actor.getId(), command.getFromAccountId(), command.getToAccountId(),
                    command.getAmount(), e.getMessage());
            throw e;
        }
    }

    private TransferResult executeTransfer(Actor actor, TransferCommand command) {
        Map<Long, Account> locked = accountRepo.lockForUpdate(
                sortedIds(command.getFromAccountId(), command.getToAccountId()));

        Account from = requireActive(locked, command.getFromAccountId());
        Account to = requireActive(locked, command.getToAccountId());

        PolicyDecision decision = hierarchyPolicy.authorize(actor, from, to);
        if (!decision.isAllowed()) {
            throw new PolicyViolationException(decision.getReason());
        }

        String note = noteFor(actor, decision, command.getNote());
        Optional<TransferResult> replay = findReplay(command.getIdempotencyKey(), entry ->
                entry.getEntryType() == EntryType.TRANSFER
                        && Objects.equals(entry.getFromAccountId(), command.getFromAccountId())
                        && entry.getToAccountId() == command.getToAccountId()
                        && entry.getAmount() == command.getAmount()
                        && Objects.equals(entry.getActorId(), actor.getId())
                        && Objects.equals(entry.getNote(), note));
        if (replay.isPresent()) {
            return replay.get();
        }

        // Read inside the lock: no concurrent movement can change this balance until we commit.
        if (from.getBalance() < command.getAmount()) {
            throw new InsufficientFundsException(from.getId(), from.getBalance(), command.getAmount());
        }

        long fromBalanceAfter = accountRepo.debit(from.getId(), command.getAmount());
        long toBalanceAfter = accountRepo.credit(to.getId(), command.getAmount());

        LedgerEntry entry = ledgerRepo.append(LedgerEntry.builder()
                .entryType(EntryType.TRANSFER)
                .fromAccountId(from.getId())
                .toAccountId(to.getId())
                .amount(command.getAmount())
                .fromBalanceAfter(fromBalanceAfter)
                .toBalanceAfter(toBalanceAfter)
                .note(note)
                .actorId(actor.getId())
                .idempotencyKey(command.getIdempotencyKey())
                .build());
        return new TransferResult(entry, false);
    }

    // =========================================================================
    // ISSUANCE
    // =========================================================================

    /**
     * Mints new credit into a reseller. The entry has no sender (the system sentinel),
     * which keeps total circulation equal to the sum of all issuance entries.
     */
    public TransferResult issue(Actor actor, IssueCommand command) {
        long started = System.nanoTime();
        try {
            if (command.getAmount() <= 0) {
                throw new InvalidAmountException(command.getAmount());
            }
            TransferResult result = inTransaction(command.getIdempotencyKey(),
                    () -> executeIssue(actor, command));
            recordOutcome(EntryType.ISSUANCE, result, started);
            return result;
        } catch (CreditLedgerException e) {
            metrics.recordRejected(EntryType.ISSUANCE, e.getErrorCode());
            log.warn("Issuance rejected: actor={}, to={}, amount={}, error={}",
                    actor.getId(), command.getToAccountId(), command.getAmount(), e.getMessage());
            throw e;
        }
    }

    private TransferResult executeIssue(Actor actor, IssueCommand command) {
        Map<Long, Account> locked = accountRepo.lockForUpdate(List.of(command.getToAccountId()));

        Account to = requireActive(locked, command.getToAccountId());

        PolicyDecision decision = hierarchyPolicy.authorizeIssuance(actor, to);
        if (!decision.isAllowed()) {
            throw new PolicyViolationException(decision.getReason());
        }

        Optional<TransferResult> replay = findReplay(command.getIdempotencyKey(), entry ->
                entry.isIssuance()
                        && entry.getToAccountId() == command.getToAccountId()
                        && entry.getAmount() == command.getAmount()
                        && Objects.equals(entry.getActorId(), actor.getId())
                        && Objects.equals(entry.getNote(), command.getNote()));
        if (replay.isPresent()) {
            return replay.get();
        }

        long toBalanceAfter = accountRepo.credit(to.getId(), command.getAmount());

        LedgerEntry entry = ledgerRepo.append(LedgerEntry.builder()
                .entryType(EntryType.ISSUANCE)
                .toAccountId(to.getId())
                .amount(command.getAmount())
                .toBalanceAfter(toBalanceAfter)
                .note(command.getNote())
                .actorId(actor.getId())
                .idempotencyKey(command.getIdempotencyKey())
                .build());
        return new TransferResult(entry, false);
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    private TransferResult inTransaction(String idempotencyKey, Supplier<TransferResult> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DuplicateKeyException e) {
            if (idempotencyKey == null) {
                throw e;
            }
            // Same key committed by a request on other accounts between our check and our insert.
            throw new IdempotencyKeyConflictException(idempotencyKey, e);
        } catch (TransientDataAccessException | RecoverableDataAccessException
                 | CannotGetJdbcConnectionException e) {
            throw new TransientStoreFailureException("Credit movement aborted, safe to retry: " + e.getMessage(), e);
        } catch (TransactionException e) {
            // Timeout, connection lost during commit, or no transaction could be started.
            throw new TransientStoreFailureException("Credit movement not committed, safe to retry: " + e.getMessage(), e);
        }
    }

    private Optional<TransferResult> findReplay(String idempotencyKey, Predicate<LedgerEntry> sameRequest) {
        if (idempotencyKey == null) {
            return Optional.empty();
        }
        return ledgerRepo.findByIdempotencyKey(idempotencyKey).map(entry -> {
            if (!sameRequest.test(entry)) {
                throw new IdempotencyKeyConflictException(idempotencyKey);
            }
            return new TransferResult(entry, true);
        });
    }

    private void recordOutcome(EntryType type, TransferResult result, long startedNanos) {
        LedgerEntry entry = result.getEntry();
        if (result.isIdempotent()) {
            metrics.recordReplayed(type);
            log.info("Idempotent replay of entry {} (key={})", entry.getId(), entry.getIdempotencyKey());
            return;
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - startedNanos);
        metrics.recordCommitted(type, duration);
        log.info("{} committed: entry={}, from={}, to={}, amount={}, fromBalance={}, toBalance={}, duration={}ms",
                type, entry.getId(), entry.getFromAccountId(), entry.getToAccountId(), entry.getAmount(),
                entry.getFromBalanceAfter(), entry.getToBalanceAfter(), duration.toMillis());
    }

    private static Account requireActive(Map<Long, Account> locked, long accountId) {
        Account account = locked.get(accountId);
        if (account == null) {
            throw new AccountNotFoundException(accountId);
        }
        if (!account.isActive()) {
            throw new AccountNotFoundException(accountId, "deactivated");
        }
        return account;
    }

    private static List<Long> sortedIds(long first, long second) {
        return Stream.of(first, second).distinct().sorted().toList();
    }

    private static String noteFor(Actor actor, PolicyDecision decision, String note) {
        if (!decision.isAdminOverride()) {
            return note;
        }
        String marker = String.format(OVERRIDE_MARKER, actor.getId());
        return note == null || note.isBlank() ? marker : marker + " " + note;
    }
}
