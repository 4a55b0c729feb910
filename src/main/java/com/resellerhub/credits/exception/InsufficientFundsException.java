package com.resellerhub.credits.exception;

public class InsufficientFundsException extends CreditLedgerException {
    public InsufficientFundsException(long accountId, long available, long requested) {
        super("INSUFFICIENT_FUNDS", String.format(
            "Insufficient funds for account %d: available=%d, requested=%d",
            accountId, available, requested
        ));
    }
}
