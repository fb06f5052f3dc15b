package com.docvault.access;

import java.time.Instant;

/** Gives a principal a role, globally or for one resource. */
public record RoleAssignment(
        String id,
        String principalId,
        String roleId,
        String resourceId,
        String grantedBy,
        Instant grantedAt,
        Instant expiresAt,
        boolean active
) {

    public boolean appliesTo(String requestedResourceId, Instant now) {
        return active
                && (expiresAt == null || expiresAt.isAfter(now))
                && (resourceId == null || resourceId.equals(requestedResourceId));
    }
}
