package com.resellerhub.credits.service;

import com.resellerhub.credits.config.LedgerProperties;
import com.resellerhub.credits.exception.AccountNotFoundException;
import com.resellerhub.credits.exception.IdempotencyKeyConflictException;
import com.resellerhub.credits.exception.InsufficientFundsException;
import com.resellerhub.credits.exception.InvalidAmountException;
import com.resellerhub.credits.exception.PolicyViolationException;
import com.resellerhub.credits.exception.TransientStoreFailureException;
import com.resellerhub.credits.model.Account;
import com.resellerhub.credits.model.Actor;
import com.resellerhub.credits.model.EntryType;
import com.resellerhub.credits.model.LedgerEntry;
import com.resellerhub.credits.model.Role;
import com.resellerhub.credits.observability.TransferMetrics;
import com.resellerhub.credits.repository.AccountRepository;
import com.resellerhub.credits.repository.LedgerRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Transfer engine behaviour with the store mocked out: validation order, rollback on
 * rejection, idempotent replay and translation of store failures.
 */
@ExtendWith(MockitoExtension.class)
class TransferEngineTest {

    private static final long RESELLER_ID = 7L;
    private static final long BO_ID = 3L;
    private static final long FOREIGN_BO_ID = 12L;

    @Mock
    private AccountRepository accountRepo;

    @Mock
    private LedgerRepository ledgerRepo;

    @Mock
    private PlatformTransactionManager txManager;

    private SimpleMeterRegistry meterRegistry;
    private TransferEngine engine;

    private final Actor resellerActor = new Actor(RESELLER_ID, Role.RESELLER);

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        engine = new TransferEngine(accountRepo, ledgerRepo, new HierarchyPolicy(),
                new TransferMetrics(meterRegistry), txManager, new LedgerProperties());
    }

    private static Account reseller(long balance) {
        return Account.builder().id(RESELLER_ID).role(Role.RESELLER).name("R")
                .balance(balance).active(true).build();
    }

    private static Account businessOwner(long id, long owner) {
        return Account.builder().id(id).role(Role.BUSINESS_OWNER).name("B" + id)
                .balance(0L).owningResellerId(owner).active(true).build();
    }

    private static TransferCommand command(long to, long amount, String key) {
        return TransferCommand.builder()
                .fromAccountId(RESELLER_ID)
                .toAccountId(to)
                .amount(amount)
                .note("monthly top-up")
                .idempotencyKey(key)
                .build();
    }

    private void stubAppendAssigningId(long id) {
        when(ledgerRepo.append(any())).thenAnswer(inv -> {
            LedgerEntry entry = inv.getArgument(0);
            entry.setId(id);
            return entry;
        });
    }

    private double counter(String type, String outcome) {
        return meterRegistry.counter("credit.movements", "type", type, "outcome", outcome).count();
    }

    // =========================================================================
    // Validation order
    // =========================================================================

    @Test
    @DisplayName("non-positive amount is rejected before touching the store")
    void zeroAmount_rejectedWithoutStoreAccess() {
        assertThatThrownBy(() -> engine.transfer(resellerActor, command(BO_ID, 0, null)))
                .isInstanceOf(InvalidAmountException.class);

        verifyNoInteractions(accountRepo, ledgerRepo, txManager);
        assertThat(counter("transfer", "invalid_amount")).isEqualTo(1.0);
    }

    @Test
    void missingReceiver_accountNotFound() {
        when(accountRepo.lockForUpdate(List.of(BO_ID, RESELLER_ID)))
                .thenReturn(Map.of(RESELLER_ID, reseller(1_000)));

        assertThatThrownBy(() -> engine.transfer(resellerActor, command(BO_ID, 100, null)))
                .isInstanceOf(AccountNotFoundException.class)
                .hasMessageContaining("id=" + BO_ID);

        verify(accountRepo, never()).debit(anyLong(), anyLong());
        verify(txManager).rollback(any());
    }

    @Test
    void deactivatedReceiver_accountNotFound() {
        Account inactive = businessOwner(BO_ID, RESELLER_ID);
        inactive.setActive(false);
        when(accountRepo.lockForUpdate(List.of(BO_ID, RESELLER_ID)))
                .thenReturn(Map.of(RESELLER_ID, reseller(1_000), BO_ID, inactive));

        assertThatThrownBy(() -> engine.transfer(resellerActor, command(BO_ID, 100, null)))
                .isInstanceOf(AccountNotFoundException.class)
                .hasMessageContaining("deactivated");
    }

    @Test
    @DisplayName("policy is checked before funds: an unfunded reseller still gets POLICY_VIOLATION")
    void foreignBusinessOwner_policyViolationBeatsInsufficientFunds() {
        when(accountRepo.lockForUpdate(List.of(RESELLER_ID, FOREIGN_BO_ID)))
                .thenReturn(Map.of(RESELLER_ID, reseller(0), FOREIGN_BO_ID, businessOwner(FOREIGN_BO_ID, 99L)));

        assertThatThrownBy(() -> engine.transfer(resellerActor, command(FOREIGN_BO_ID, 500, null)))
                .isInstanceOf(PolicyViolationException.class);

        verify(accountRepo, never()).debit(anyLong(), anyLong());
        verify(accountRepo, never()).credit(anyLong(), anyLong());
        verify(ledgerRepo, never()).append(any());
    }

    @Test
    void overdraft_insufficientFundsAndNothingWritten() {
        when(accountRepo.lockForUpdate(List.of(BO_ID, RESELLER_ID)))
                .thenReturn(Map.of(RESELLER_ID, reseller(5_000), BO_ID, businessOwner(BO_ID, RESELLER_ID)));

        assertThatThrownBy(() -> engine.transfer(resellerActor, command(BO_ID, 6_000, null)))
                .isInstanceOf(InsufficientFundsException.class)
                .hasMessageContaining("available=5000, requested=6000");

        verify(accountRepo, never()).debit(anyLong(), anyLong());
        verify(ledgerRepo, never()).append(any());
        verify(txManager).rollback(any());
        assertThat(counter("transfer", "insufficient_funds")).isEqualTo(1.0);
    }

    // =========================================================================
    // Commit path
    // =========================================================================

    @Test
    @DisplayName("successful transfer locks in id order, debits, credits and appends one entry")
    void transfer_commitsAllThreeWrites() {
        when(accountRepo.lockForUpdate(List.of(BO_ID, RESELLER_ID)))
                .thenReturn(Map.of(RESELLER_ID, reseller(10_000), BO_ID, businessOwner(BO_ID, RESELLER_ID)));
        when(accountRepo.debit(RESELLER_ID, 5_000)).thenReturn(5_000L);
        when(accountRepo.credit(BO_ID, 5_000)).thenReturn(5_000L);
        stubAppendAssigningId(1L);

        TransferResult result = engine.transfer(resellerActor, command(BO_ID, 5_000, null));

        assertThat(result.isIdempotent()).isFalse();
        LedgerEntry entry = result.getEntry();
        assertThat(entry.getId()).isEqualTo(1L);
        assertThat(entry.getEntryType()).isEqualTo(EntryType.TRANSFER);
        assertThat(entry.getFromAccountId()).isEqualTo(RESELLER_ID);
        assertThat(entry.getToAccountId()).isEqualTo(BO_ID);
        assertThat(entry.getAmount()).isEqualTo(5_000L);
        assertThat(entry.getFromBalanceAfter()).isEqualTo(5_000L);
        assertThat(entry.getToBalanceAfter()).isEqualTo(5_000L);
        assertThat(entry.getNote()).isEqualTo("monthly top-up");
        assertThat(entry.getActorId()).isEqualTo(RESELLER_ID);

        verify(txManager).commit(any());
        assertThat(counter("transfer", "committed")).isEqualTo(1.0);
    }

    @Test
    void adminOverride_isMarkedInNote() {
        when(accountRepo.lockForUpdate(List.of(BO_ID, RESELLER_ID)))
                .thenReturn(Map.of(RESELLER_ID, reseller(100), BO_ID, businessOwner(BO_ID, RESELLER_ID)));
        when(accountRepo.debit(RESELLER_ID, 40)).thenReturn(60L);
        when(accountRepo.credit(BO_ID, 40)).thenReturn(40L);
        stubAppendAssigningId(2L);

        TransferResult result = engine.transfer(new Actor(500L, Role.ADMIN), command(BO_ID, 40, null));

        assertThat(result.getEntry().getNote()).isEqualTo("[admin-override by actor 500] monthly top-up");
        assertThat(result.getEntry().getActorId()).isEqualTo(500L);
    }

    // =========================================================================
    // Idempotency
    // =========================================================================

    private static LedgerEntry storedTransfer(long amount, String note) {
        return LedgerEntry.builder().id(42L).entryType(EntryType.TRANSFER)
                .fromAccountId(RESELLER_ID).toAccountId(BO_ID).amount(amount)
                .fromBalanceAfter(700L).toBalanceAfter(amount).note(note)
                .actorId(RESELLER_ID).idempotencyKey("k-1").build();
    }

    @Test
    void sameKeySameRequest_replaysWithoutMovingCredit() {
        LedgerEntry original = storedTransfer(300L, "monthly top-up");
        when(accountRepo.lockForUpdate(List.of(BO_ID, RESELLER_ID)))
                .thenReturn(Map.of(RESELLER_ID, reseller(700), BO_ID, businessOwner(BO_ID, RESELLER_ID)));
        when(ledgerRepo.findByIdempotencyKey("k-1")).thenReturn(Optional.of(original));

        TransferResult result = engine.transfer(resellerActor, command(BO_ID, 300, "k-1"));

        assertThat(result.isIdempotent()).isTrue();
        assertThat(result.getEntry()).isSameAs(original);
        verify(accountRepo, never()).debit(anyLong(), anyLong());
        verify(ledgerRepo, never()).append(any());
        assertThat(counter("transfer", "replayed")).isEqualTo(1.0);
    }

    @Test
    void sameKeyDifferentAmount_conflict() {
        LedgerEntry original = storedTransfer(300L, "monthly top-up");
        when(accountRepo.lockForUpdate(List.of(BO_ID, RESELLER_ID)))
                .thenReturn(Map.of(RESELLER_ID, reseller(700), BO_ID, businessOwner(BO_ID, RESELLER_ID)));
        when(ledgerRepo.findByIdempotencyKey("k-1")).thenReturn(Optional.of(original));

        assertThatThrownBy(() -> engine.transfer(resellerActor, command(BO_ID, 301, "k-1")))
                .isInstanceOf(IdempotencyKeyConflictException.class);
    }

    @Test
    void sameKeyDifferentNote_conflict() {
        LedgerEntry original = storedTransfer(300L, "monthly top-up");
        when(accountRepo.lockForUpdate(List.of(BO_ID, RESELLER_ID)))
                .thenReturn(Map.of(RESELLER_ID, reseller(700), BO_ID, businessOwner(BO_ID, RESELLER_ID)));
        when(ledgerRepo.findByIdempotencyKey("k-1")).thenReturn(Optional.of(original));

        TransferCommand retry = TransferCommand.builder().fromAccountId(RESELLER_ID).toAccountId(BO_ID)
                .amount(300).note("quarterly bonus").idempotencyKey("k-1").build();

        assertThatThrownBy(() -> engine.transfer(resellerActor, retry))
                .isInstanceOf(IdempotencyKeyConflictException.class);
        verify(ledgerRepo, never()).append(any());
    }

    @Test
    @DisplayName("a caller the policy rejects learns nothing from a known key")
    void businessOwnerReusingResellerKey_policyViolationWithoutReplay() {
        LedgerEntry original = storedTransfer(300L, "monthly top-up");
        when(accountRepo.lockForUpdate(List.of(BO_ID, RESELLER_ID)))
                .thenReturn(Map.of(RESELLER_ID, reseller(700), BO_ID, businessOwner(BO_ID, RESELLER_ID)));
        lenient().when(ledgerRepo.findByIdempotencyKey("k-1")).thenReturn(Optional.of(original));

        assertThatThrownBy(() -> engine.transfer(new Actor(BO_ID, Role.BUSINESS_OWNER), command(BO_ID, 300, "k-1")))
                .isInstanceOf(PolicyViolationException.class);

        verify(ledgerRepo, never()).findByIdempotencyKey(any());
        verify(accountRepo, never()).debit(anyLong(), anyLong());
        verify(ledgerRepo, never()).append(any());
        assertThat(counter("transfer", "replayed")).isZero();
        assertThat(counter("transfer", "policy_violation")).isEqualTo(1.0);
    }

    @Test
    void sameKeyFromAnotherAuthorizedActor_conflict() {
        LedgerEntry original = storedTransfer(300L, "monthly top-up");
        when(accountRepo.lockForUpdate(List.of(BO_ID, RESELLER_ID)))
                .thenReturn(Map.of(RESELLER_ID, reseller(700), BO_ID, businessOwner(BO_ID, RESELLER_ID)));
        when(ledgerRepo.findByIdempotencyKey("k-1")).thenReturn(Optional.of(original));

        assertThatThrownBy(() -> engine.transfer(new Actor(500L, Role.ADMIN), command(BO_ID, 300, "k-1")))
                .isInstanceOf(IdempotencyKeyConflictException.class);
        verify(accountRepo, never()).debit(anyLong(), anyLong());
    }

    @Test
    @DisplayName("a unique-key race on append is reported as a key conflict")
    void duplicateKeyOnAppend_conflict() {
        when(accountRepo.lockForUpdate(List.of(BO_ID, RESELLER_ID)))
                .thenReturn(Map.of(RESELLER_ID, reseller(700), BO_ID, businessOwner(BO_ID, RESELLER_ID)));
        when(ledgerRepo.findByIdempotencyKey("k-2")).thenReturn(Optional.empty());
        when(accountRepo.debit(RESELLER_ID, 100)).thenReturn(600L);
        when(accountRepo.credit(BO_ID, 100)).thenReturn(100L);
        when(ledgerRepo.append(any())).thenThrow(new DuplicateKeyException("idempotency_key"));

        assertThatThrownBy(() -> engine.transfer(resellerActor, command(BO_ID, 100, "k-2")))
                .isInstanceOf(IdempotencyKeyConflictException.class);
        verify(txManager).rollback(any());
    }

    // =========================================================================
    // Store failures
    // =========================================================================

    @Test
    void lockTimeout_surfacesAsTransientFailure() {
        when(accountRepo.lockForUpdate(List.of(BO_ID, RESELLER_ID)))
                .thenThrow(new CannotAcquireLockException("lock wait timeout"));

        assertThatThrownBy(() -> engine.transfer(resellerActor, command(BO_ID, 100, null)))
                .isInstanceOf(TransientStoreFailureException.class)
                .hasCauseInstanceOf(CannotAcquireLockException.class);
        assertThat(counter("transfer", "transient_store_failure")).isEqualTo(1.0);
    }

    // =========================================================================
    // Issuance
    // =========================================================================

    @Test
    void adminIssuance_recordsSystemSender() {
        when(accountRepo.lockForUpdate(List.of(RESELLER_ID))).thenReturn(Map.of(RESELLER_ID, reseller(0)));
        when(accountRepo.credit(RESELLER_ID, 10_000)).thenReturn(10_000L);
        stubAppendAssigningId(1L);

        TransferResult result = engine.issue(new Actor(500L, Role.ADMIN), IssueCommand.builder()
                .toAccountId(RESELLER_ID).amount(10_000).note("opening balance").build());

        LedgerEntry entry = result.getEntry();
        assertThat(entry.isIssuance()).isTrue();
        assertThat(entry.getFromAccountId()).isNull();
        assertThat(entry.getFromBalanceAfter()).isNull();
        assertThat(entry.getToBalanceAfter()).isEqualTo(10_000L);
        verify(accountRepo, never()).debit(anyLong(), anyLong());
    }

    @Test
    void issuanceReplay_requiresSameActorAndNote() {
        LedgerEntry original = LedgerEntry.builder().id(9L).entryType(EntryType.ISSUANCE)
                .toAccountId(RESELLER_ID).amount(10_000L).toBalanceAfter(10_000L)
                .note("opening balance").actorId(500L).idempotencyKey("mint-1").build();
        when(accountRepo.lockForUpdate(List.of(RESELLER_ID))).thenReturn(Map.of(RESELLER_ID, reseller(10_000)));
        when(ledgerRepo.findByIdempotencyKey("mint-1")).thenReturn(Optional.of(original));

        TransferResult replay = engine.issue(new Actor(500L, Role.ADMIN), IssueCommand.builder()
                .toAccountId(RESELLER_ID).amount(10_000).note("opening balance").idempotencyKey("mint-1").build());
        assertThat(replay.isIdempotent()).isTrue();

        assertThatThrownBy(() -> engine.issue(new Actor(501L, Role.ADMIN), IssueCommand.builder()
                .toAccountId(RESELLER_ID).amount(10_000).note("opening balance").idempotencyKey("mint-1").build()))
                .isInstanceOf(IdempotencyKeyConflictException.class);
        assertThatThrownBy(() -> engine.issue(new Actor(500L, Role.ADMIN), IssueCommand.builder()
                .toAccountId(RESELLER_ID).amount(10_000).note("correction").idempotencyKey("mint-1").build()))
                .isInstanceOf(IdempotencyKeyConflictException.class);
        verify(accountRepo, never()).credit(anyLong(), anyLong());
    }

    @Test
    void resellerCannotIssue() {
        when(accountRepo.lockForUpdate(List.of(RESELLER_ID))).thenReturn(Map.of(RESELLER_ID, reseller(0)));

        assertThatThrownBy(() -> engine.issue(resellerActor, IssueCommand.builder()
                .toAccountId(RESELLER_ID).amount(10).build()))
                .isInstanceOf(PolicyViolationException.class);
        verify(accountRepo, never()).credit(anyLong(), anyLong());
    }
}
