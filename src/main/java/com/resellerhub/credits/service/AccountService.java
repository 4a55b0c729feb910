package com.resellerhub.credits.service;

import com.resellerhub.credits.exception.AccountNotFoundException;
import com.resellerhub.credits.model.Account;
import com.resellerhub.credits.model.Role;
import com.resellerhub.credits.model.dto.CreateAccountRequest;
import com.resellerhub.credits.repository.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Provisioning side of the account table: the user-management integration creates,
 * resolves and deactivates accounts through here. Balances are never touched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepo;

    @Transactional
    public Account provision(CreateAccountRequest req) {
        if (!req.getRole().holdsCredit()) {
            throw new IllegalArgumentException("role " + req.getRole() + " cannot hold a credit account");
        }
        if (req.getRole() == Role.RESELLER && req.getOwningResellerId() != null) {
            throw new IllegalArgumentException("a reseller cannot have an owning reseller");
        }
        if (req.getRole() == Role.BUSINESS_OWNER) {
            if (req.getOwningResellerId() == null) {
                throw new IllegalArgumentException("owning_reseller_id is required for a business owner");
            }
            Account owner = accountRepo.findById(req.getOwningResellerId())
                    .filter(Account::isActive)
                    .orElseThrow(() -> new AccountNotFoundException(req.getOwningResellerId()));
            if (owner.getRole() != Role.RESELLER) {
                throw new IllegalArgumentException("account " + owner.getId() + " is not a reseller");
            }
        }
        Account account = accountRepo.save(req.getRole(), req.getName(), req.getOwningResellerId());
        log.info("Provisioned {} account {} ({})", account.getRole(), account.getId(), account.getName());
        return account;
    }

    @Transactional(readOnly = true)
    public Account resolve(long accountId) {
        return accountRepo.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    @Transactional(readOnly = true)
    public List<Account> list(Role role, Long owningResellerId) {
        return accountRepo.findAll(role, owningResellerId);
    }

    @Transactional(readOnly = true)
    public long getBalance(long accountId) {
        return resolve(accountId).getBalance();
    }

    /**
     * Soft delete: the account stops sending and receiving, its balance and history stay.
     */
    @Transactional
    public Account deactivate(long accountId) {
        Account account = resolve(accountId);
        if (accountRepo.deactivate(accountId)) {
            log.info("Deactivated account {} with balance {}", accountId, account.getBalance());
        }
        return resolve(accountId);
    }
}
