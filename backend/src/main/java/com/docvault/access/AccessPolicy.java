package com.docvault.access;

import java.time.Instant;
import java.util.List;

/** Organisation-wide rules, consulted after grants, roles and ACLs. */
public record AccessPolicy(
        String id,
        String name,
        String description,
        boolean active,
        List<PolicyRule> rules,
        Instant createdAt
) {

    public AccessPolicy {
        rules = rules != null ? List.copyOf(rules) : List.of();
    }

    public AccessPolicy deactivated() {
        return new AccessPolicy(id, name, description, false, rules, createdAt);
    }
}
