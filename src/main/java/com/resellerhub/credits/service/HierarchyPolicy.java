package com.resellerhub.credits.service;

import com.resellerhub.credits.model.Account;
import com.resellerhub.credits.model.Actor;
import com.resellerhub.credits.model.Role;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Which way credit may flow. Pure function of the actor and the two accounts:
 * no I/O, no state.
 *
 * Rules:
 *   - only a RESELLER sends, only a BUSINESS_OWNER receives;
 *   - the receiver must be owned by the sender;
 *   - the sender initiates its own transfers, except that an ADMIN may act on any
 *     reseller's behalf (reported as an override so the entry can be marked).
 */
@Component
public class HierarchyPolicy {

    public PolicyDecision authorize(Actor actor, Account from, Account to) {
        if (from.getRole() != Role.RESELLER) {
            return PolicyDecision.deny(String.format(
                    "account %d is a %s; only resellers can send credits", from.getId(), from.getRole()));
        }
        if (to.getRole() != Role.BUSINESS_OWNER) {
            return PolicyDecision.deny(String.format(
                    "account %d is a %s; only business owners can receive credits", to.getId(), to.getRole()));
        }
        if (!Objects.equals(to.getOwningResellerId(), from.getId())) {
            return PolicyDecision.deny(String.format(
                    "business owner %d is not owned by reseller %d", to.getId(), from.getId()));
        }
        if (actor.getRole() == Role.RESELLER && actor.getId() == from.getId()) {
            return PolicyDecision.allow();
        }
        if (actor.isAdmin()) {
            return PolicyDecision.allowByAdminOverride();
        }
        return PolicyDecision.deny(String.format(
                "actor %d (%s) may not transfer on behalf of reseller %d",
                actor.getId(), actor.getRole(), from.getId()));
    }

    /**
     * Minting new credit: administrators only, and only into a reseller.
     */
    public PolicyDecision authorizeIssuance(Actor actor, Account to) {
        if (!actor.isAdmin()) {
            return PolicyDecision.deny(String.format(
                    "actor %d (%s) may not issue credits", actor.getId(), actor.getRole()));
        }
        if (to.getRole() != Role.RESELLER) {
            return PolicyDecision.deny(String.format(
                    "account %d is a %s; credits are only issued to resellers", to.getId(), to.getRole()));
        }
        return PolicyDecision.allow();
    }
}
