package com.resellerhub.credits.exception;

public class IdempotencyKeyConflictException extends CreditLedgerException {
    public IdempotencyKeyConflictException(String idempotencyKey) {
        super("IDEMPOTENCY_KEY_CONFLICT",
            "Idempotency-Key '" + idempotencyKey + "' was already used for a different request");
    }

    public IdempotencyKeyConflictException(String idempotencyKey, Throwable cause) {
        super("IDEMPOTENCY_KEY_CONFLICT",
            "Idempotency-Key '" + idempotencyKey + "' was already used for a different request", cause);
    }
}
