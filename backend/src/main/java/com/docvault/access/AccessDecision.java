package com.docvault.access;

/**
 * Outcome of {@link AccessEvaluator#checkAccess}. {@code detail} names the grant, role, ACL
 * entry or policy that decided.
 */
public record AccessDecision(
        boolean granted,
        AccessReason reason,
        DecisionTier policy,
        String detail
) {

    static AccessDecision allow(AccessReason reason, DecisionTier tier, String detail) {
        return new AccessDecision(true, reason, tier, detail);
    }

    static AccessDecision deny(AccessReason reason, DecisionTier tier, String detail) {
        return new AccessDecision(false, reason, tier, detail);
    }

    static AccessDecision noMatch() {
        return new AccessDecision(false, AccessReason.NO_MATCHING_PERMISSION, DecisionTier.NONE, null);
    }
}
