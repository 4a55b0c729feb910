package com.resellerhub.credits.service;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TransferCommand {
    long fromAccountId;
    long toAccountId;
    long amount;
    String note;
    /** Optional; repeated submissions with the same key replay the first result. */
    String idempotencyKey;
}
