package com.docvault.access;

import java.util.ArrayList;
import java.util.List;

/** All policies, in definition order. */
public record PolicySet(List<AccessPolicy> policies) {

    public PolicySet {
        policies = policies != null ? List.copyOf(policies) : List.of();
    }

    public static PolicySet empty() {
        return new PolicySet(List.of());
    }

    /** Adds {@code policy}, or replaces the policy with the same id in place. */
    public PolicySet with(AccessPolicy policy) {
        List<AccessPolicy> next = new ArrayList<>(policies);
        for (int i = 0; i < next.size(); i++) {
            if (next.get(i).id().equals(policy.id())) {
                next.set(i, policy);
                return new PolicySet(next);
            }
        }
        next.add(policy);
        return new PolicySet(next);
    }
}
