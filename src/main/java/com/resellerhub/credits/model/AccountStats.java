package com.resellerhub.credits.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

@Value
@Builder
public class AccountStats {
    long accountId;
    Role role;
    long totalSent;
    long totalReceived;
    long currentBalance;
    long entryCount;
    OffsetDateTime firstEntryTime;
    OffsetDateTime lastEntryTime;
    /** Number of business owners funded by this account; null unless it is a reseller. */
    Long ownedBusinessOwners;
}
