package com.resellerhub.credits.service;

import com.resellerhub.credits.model.LedgerEntry;
import lombok.Value;

@Value
public class TransferResult {
    LedgerEntry entry;
    boolean idempotent;
}
