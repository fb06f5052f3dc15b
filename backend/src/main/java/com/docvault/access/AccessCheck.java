package com.docvault.access;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * One "may principal P do A on resource R" question. {@code principalRole} is the role the
 * caller is acting in, if any; stored role assignments are consulted as well.
 */
public record AccessCheck(
        String resourceId,
        String resourceType,
        Action action,
        String principalId,
        String principalRole,
        Map<String, Object> context
) {

    public AccessCheck {
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("principalId is required");
        }
        if (resourceType == null || resourceType.isBlank()) {
            throw new IllegalArgumentException("resourceType is required");
        }
        if (action == null || action == Action.ANY) {
            throw new IllegalArgumentException("A concrete action is required");
        }
        context = context != null ? Collections.unmodifiableMap(new HashMap<>(context)) : Map.of();
    }

    public static AccessCheck of(String principalId, Action action, String resourceType, String resourceId) {
        return new AccessCheck(resourceId, resourceType, action, principalId, null, Map.of());
    }
}
