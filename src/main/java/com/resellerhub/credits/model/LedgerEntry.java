package com.resellerhub.credits.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * One completed credit movement. Rows are only ever inserted.
 *
 * Issuance entries carry no sender: a null {@code fromAccountId} stands for the system.
 */
@Data
@Builder
public class LedgerEntry {
    private Long id;
    private EntryType entryType;
    private Long fromAccountId;
    private Long toAccountId;
    private Long amount;
    private Long fromBalanceAfter;
    private Long toBalanceAfter;
    private String note;
    private Long actorId;
    private String idempotencyKey;
    private OffsetDateTime createdAt;

    public boolean isIssuance() {
        return entryType == EntryType.ISSUANCE;
    }
}
