package com.docvault.share;

import java.time.Instant;
import java.util.Map;

/**
 * Figures computed from a share's access log on every read. {@code totalAccesses} counts
 * successful attempts in the requested window; {@code archivedAccesses} are successes already
 * pruned from the log.
 */
public record ShareAnalytics(
        String shareId,
        long totalAccesses,
        long views,
        long downloads,
        long uniquePrincipals,
        long failedAttempts,
        Instant lastAccessedAt,
        Map<String, Long> accessesPerDay,
        Map<String, Long> accessesPerLocation,
        Map<String, Long> accessesPerDevice,
        long archivedAccesses,
        boolean expired,
        boolean limitReached
) {
}
