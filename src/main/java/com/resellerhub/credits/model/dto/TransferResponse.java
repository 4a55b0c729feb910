package com.resellerhub.credits.model.dto;

import com.resellerhub.credits.model.LedgerEntry;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class TransferResponse {
    private LedgerEntry entry;
    /**
     * true if this response was replayed from a previously committed
     * request with the same Idempotency-Key (no new movement occurred).
     */
    private boolean idempotent;
}
