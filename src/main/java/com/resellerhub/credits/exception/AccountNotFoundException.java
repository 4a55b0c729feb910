package com.resellerhub.credits.exception;

public class AccountNotFoundException extends CreditLedgerException {
    public AccountNotFoundException(long id) {
        super("ACCOUNT_NOT_FOUND", "Account not found: id=" + id);
    }

    public AccountNotFoundException(long id, String reason) {
        super("ACCOUNT_NOT_FOUND", "Account not found: id=" + id + " (" + reason + ")");
    }
}
