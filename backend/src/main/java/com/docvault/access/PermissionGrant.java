package com.docvault.access;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

/**
 * A permission granted directly to one principal. Optionally limited to a single resource, to a
 * time window and to context conditions. A grant of {@code *} on {@code *} is admin-all.
 */
public record PermissionGrant(
        String id,
        String principalId,
        String resourceType,
        String resourceId,
        Action action,
        String grantedBy,
        Instant grantedAt,
        Instant expiresAt,
        List<Condition> conditions
) {

    public PermissionGrant {
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }

    @JsonIgnore
    public boolean isAdminAll() {
        return Permission.ANY_RESOURCE.equals(resourceType) && action == Action.ANY && resourceId == null;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public boolean matches(AccessCheck check, Instant now) {
        if (isExpired(now)) {
            return false;
        }
        if (isAdminAll()) {
            return true;
        }
        return Permission.resourceTypeMatches(resourceType, check.resourceType())
                && (resourceId == null || resourceId.equals(check.resourceId()))
                && action != null && action.covers(check.action())
                && ConditionEvaluator.allSatisfied(conditions, check.context());
    }

    /** Identifier in the {@code <action>_<resourceType>} form, e.g. {@code read_document}. */
    public String permissionId() {
        return isAdminAll() ? "admin_all" : action.code() + "_" + resourceType;
    }
}
