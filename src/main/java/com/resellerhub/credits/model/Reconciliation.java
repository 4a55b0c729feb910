package com.resellerhub.credits.model;

import lombok.Value;

@Value
public class Reconciliation {
    long accountId;
    long balance;
    /** Credits received minus credits sent, as recorded in the ledger. */
    long ledgerNet;

    public boolean isReconciled() {
        return balance == ledgerNet;
    }
}
