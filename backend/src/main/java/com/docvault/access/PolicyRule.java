package com.docvault.access;

import java.util.List;

public record PolicyRule(
        String resourceType,
        Action action,
        List<Condition> conditions,
        Effect effect
) {

    public PolicyRule {
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }

    public boolean matches(AccessCheck check) {
        return Permission.resourceTypeMatches(resourceType, check.resourceType())
                && action != null && action.covers(check.action())
                && ConditionEvaluator.allSatisfied(conditions, check.context());
    }
}
