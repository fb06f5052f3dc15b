package com.docvault.access;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates {@link Condition}s against a request context. All conditions must hold; a field
 * missing from the context fails its condition. Numbers (or numeric strings) compare
 * numerically, anything else compares as text. NaN and infinite values satisfy no ordering or
 * equality condition.
 */
final class ConditionEvaluator {

    private ConditionEvaluator() {}

    static boolean allSatisfied(List<Condition> conditions, Map<String, Object> context) {
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }
        Map<String, Object> values = context != null ? context : Map.of();
        for (Condition condition : conditions) {
            if (!satisfied(condition, values.get(condition.field()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean satisfied(Condition condition, Object actual) {
        if (actual == null || condition.operator() == null) {
            return false;
        }
        Object expected = condition.value();
        switch (condition.operator()) {
            case EQUALS:
                return ordered(actual, expected, 0);
            case CONTAINS:
                return contains(actual, expected);
            case GREATER_THAN:
                return ordered(actual, expected, 1);
            case LESS_THAN:
                return ordered(actual, expected, -1);
            default:
                return false;
        }
    }

    private static boolean ordered(Object actual, Object expected, int expectedSign) {
        Integer result = compare(actual, expected);
        return result != null && Integer.signum(result) == expectedSign;
    }

    private static boolean contains(Object actual, Object expected) {
        if (expected == null) {
            return false;
        }
        if (actual instanceof Collection<?> collection) {
            return collection.stream().anyMatch(item -> Objects.equals(String.valueOf(item), String.valueOf(expected)));
        }
        return actual.toString().contains(expected.toString());
    }

    /** Null when the two values cannot be ordered. */
    private static Integer compare(Object actual, Object expected) {
        if (expected == null || nonFinite(actual) || nonFinite(expected)) {
            return null;
        }
        BigDecimal left = asNumber(actual);
        BigDecimal right = asNumber(expected);
        if (left != null && right != null) {
            return left.compareTo(right);
        }
        if (actual instanceof Collection<?> || expected instanceof Collection<?>) {
            return null;
        }
        return actual.toString().compareTo(expected.toString());
    }

    private static boolean nonFinite(Object value) {
        if (value instanceof Double number) {
            return !Double.isFinite(number);
        }
        if (value instanceof Float number) {
            return !Float.isFinite(number);
        }
        return false;
    }

    private static BigDecimal asNumber(Object value) {
        if (!(value instanceof Number) && !(value instanceof String)) {
            return null;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
