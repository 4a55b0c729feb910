package com.resellerhub.credits.exception;

/**
 * Base type for every failure the ledger reports to its callers. Each subclass
 * carries a stable error code that ends up in the API error body and in metrics.
 */
public abstract class CreditLedgerException extends RuntimeException {

    private final String errorCode;

    protected CreditLedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected CreditLedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
