package com.docvault.access;

/**
 * A comparison between a request-context field and a constant, e.g.
 * {@code ownerId equals "alice"} or {@code clearance greater_than 2}.
 */
public record Condition(String field, ConditionOperator operator, Object value) {}
