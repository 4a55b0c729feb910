package com.resellerhub.credits.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PlatformSummary {
    /** Sum of every account balance. Equals {@link #totalIssued} while the ledger is consistent. */
    long totalInCirculation;
    long totalIssued;
    long totalTransfers;
    long totalVolume;
    double averageTransfer;
    List<ResellerBreakdown> perResellerBreakdown;
}
