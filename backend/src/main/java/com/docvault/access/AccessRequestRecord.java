package com.docvault.access;

import java.time.Instant;
import java.util.List;

/** A principal asking a resource owner for actions it does not yet hold. */
public record AccessRequestRecord(
        String id,
        String requestedBy,
        String resourceId,
        String resourceType,
        List<Action> actions,
        String reason,
        AccessRequestStatus status,
        String reviewedBy,
        Instant reviewedAt,
        String responseMessage,
        Instant createdAt,
        Instant expiresAt
) {

    public AccessRequestRecord {
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    public AccessRequestRecord reviewed(AccessRequestStatus outcome, String reviewer, Instant at, String message) {
        return new AccessRequestRecord(id, requestedBy, resourceId, resourceType, actions, reason,
                outcome, reviewer, at, message, createdAt, expiresAt);
    }
}
