package com.docvault.access;

import java.time.Instant;
import java.util.List;

public record AclEntry(
        String id,
        String principalId,
        PrincipalType principalType,
        Effect effect,
        List<Action> actions,
        String grantedBy,
        Instant grantedAt,
        Instant expiresAt
) {

    public AclEntry {
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public boolean covers(Action requested) {
        return actions.stream().anyMatch(action -> action.covers(requested));
    }
}
