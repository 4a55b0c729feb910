package com.resellerhub.credits.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Filters for a per-account history page. Every field except the account is optional.
 */
@Value
@Builder(toBuilder = true)
public class LedgerQuery {
    long accountId;
    /** Inclusive lower bound on entry time. */
    OffsetDateTime from;
    /** Exclusive upper bound on entry time. */
    OffsetDateTime to;
    Role counterpartRole;
    /** Id of the last entry already seen; the page starts strictly after it. */
    Long cursor;
    Integer limit;
    @Builder.Default
    SortDirection direction = SortDirection.ASC;
}
