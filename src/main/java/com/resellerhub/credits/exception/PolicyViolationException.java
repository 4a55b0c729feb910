package com.resellerhub.credits.exception;

public class PolicyViolationException extends CreditLedgerException {
    public PolicyViolationException(String reason) {
        super("POLICY_VIOLATION", "Policy violation: " + reason);
    }
}
