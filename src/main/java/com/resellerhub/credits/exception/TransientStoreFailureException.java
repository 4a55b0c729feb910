package com.resellerhub.credits.exception;

/**
 * The store could not complete the unit of work (lock wait timeout, deadlock victim,
 * lost connection during commit). Nothing was committed; the identical request is safe to retry.
 */
public class TransientStoreFailureException extends CreditLedgerException {
    public TransientStoreFailureException(String message, Throwable cause) {
        super("TRANSIENT_STORE_FAILURE", message, cause);
    }
}
