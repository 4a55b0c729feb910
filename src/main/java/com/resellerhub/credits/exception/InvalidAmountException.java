package com.resellerhub.credits.exception;

public class InvalidAmountException extends CreditLedgerException {
    public InvalidAmountException(long amount) {
        super("INVALID_AMOUNT", "Amount must be positive: amount=" + amount);
    }
}
