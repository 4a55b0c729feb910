package com.resellerhub.credits.model.dto;

import com.resellerhub.credits.model.LedgerEntry;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * One page of ledger history. Pass {@code nextCursor} back as {@code cursor} to continue.
 */
@Data
@AllArgsConstructor
public class LedgerPage {
    private List<LedgerEntry> entries;
    private Long nextCursor;
    private boolean hasMore;
}
