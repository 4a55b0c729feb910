package com.resellerhub.credits.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ResellerBreakdown {
    long resellerId;
    String name;
    long balance;
    long totalSent;
    long transferCount;
    long businessOwnerCount;
    long businessOwnerBalance;
}
