package com.docvault.access;

import java.util.List;

/**
 * A named permission set. Higher {@code hierarchyLevel} means more authority
 * (admin 100, user 10, family_member 5, guest 1).
 */
public record Role(
        String id,
        String name,
        String description,
        int hierarchyLevel,
        List<Permission> permissions,
        boolean systemRole
) {

    public Role {
        permissions = permissions != null ? List.copyOf(permissions) : List.of();
    }

    public boolean outranks(Role other) {
        return other == null || hierarchyLevel > other.hierarchyLevel;
    }
}
