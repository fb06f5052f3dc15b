package com.docvault.share;

import java.time.Instant;
import java.util.List;

/** Everything a user has shared, with all-time analytics per share. Tokens are not included. */
public record ShareExport(
        String createdBy,
        List<ShareSummary> shares,
        List<ShareAnalytics> analytics,
        int totalShares,
        int activeShares,
        Instant exportedAt
) {
}
