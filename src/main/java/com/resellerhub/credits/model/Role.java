package com.resellerhub.credits.model;

/**
 * Closed set of roles known to the ledger.
 *
 * RESELLER and BUSINESS_OWNER hold credit. ADMIN is an actor-only role used for
 * issuance and operational corrections; no account is ever provisioned with it.
 */
public enum Role {
    RESELLER,
    BUSINESS_OWNER,
    ADMIN;

    public boolean holdsCredit() {
        return this != ADMIN;
    }
}
