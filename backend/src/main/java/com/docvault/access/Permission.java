package com.docvault.access;

import java.util.List;
import java.util.Map;

/**
 * A named permission carried by a {@link Role}. {@code resourceType} may be {@code "*"}.
 */
public record Permission(
        String id,
        String name,
        String resourceType,
        Action action,
        List<Condition> conditions
) {

    public static final String ANY_RESOURCE = "*";

    public Permission {
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }

    public static Permission of(String id, String resourceType, Action action) {
        return new Permission(id, id, resourceType, action, List.of());
    }

    public boolean matches(String requestedType, Action requested, Map<String, Object> context) {
        return resourceTypeMatches(resourceType, requestedType)
                && action != null && action.covers(requested)
                && ConditionEvaluator.allSatisfied(conditions, context);
    }

    static boolean resourceTypeMatches(String pattern, String requestedType) {
        return ANY_RESOURCE.equals(pattern) || (pattern != null && pattern.equals(requestedType));
    }
}
