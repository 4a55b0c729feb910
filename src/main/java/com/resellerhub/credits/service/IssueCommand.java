package com.resellerhub.credits.service;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IssueCommand {
    long toAccountId;
    long amount;
    String note;
    String idempotencyKey;
}
