package com.resellerhub.credits.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a hierarchy check. A denial always carries a reason.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PolicyDecision {

    private static final PolicyDecision ALLOW = new PolicyDecision(true, false, null);
    private static final PolicyDecision ADMIN_OVERRIDE = new PolicyDecision(true, true, null);

    boolean allowed;
    /** True when an administrator initiated the movement on a reseller's behalf. */
    boolean adminOverride;
    String reason;

    public static PolicyDecision allow() {
        return ALLOW;
    }

    public static PolicyDecision allowByAdminOverride() {
        return ADMIN_OVERRIDE;
    }

    public static PolicyDecision deny(String reason) {
        return new PolicyDecision(false, false, reason);
    }
}
