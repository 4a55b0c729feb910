package com.resellerhub.credits.model;

public enum EntryType {
    /** Reseller to business owner movement. */
    TRANSFER,
    /** Administrative minting into a reseller; the sender is the system sentinel. */
    ISSUANCE
}
