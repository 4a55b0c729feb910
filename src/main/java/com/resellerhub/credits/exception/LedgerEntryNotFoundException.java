package com.resellerhub.credits.exception;

public class LedgerEntryNotFoundException extends CreditLedgerException {
    public LedgerEntryNotFoundException(long id) {
        super("ENTRY_NOT_FOUND", "Ledger entry not found: id=" + id);
    }
}
