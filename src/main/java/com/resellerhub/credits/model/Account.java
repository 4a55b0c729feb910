package com.resellerhub.credits.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class Account {
    private Long id;
    private Role role;
    private String name;
    private Long balance;
    /** Set only for business owners: the single reseller allowed to fund this account. */
    private Long owningResellerId;
    private boolean active;
    private OffsetDateTime createdAt;
}
