package com.docvault.share;

import java.time.Instant;

/**
 * One attempt to use a share. Appended, never edited; removed only by retention pruning.
 * {@code sourceHint} is a caller-supplied origin (region, network) used for per-location counts.
 */
public record AccessLogEntry(
        String id,
        String principal,
        Instant timestamp,
        ShareAction action,
        AccessOutcome outcome,
        ShareFailure reason,
        String sourceHint,
        String userAgent,
        DeviceType deviceType
) {

    public boolean succeeded() {
        return outcome == AccessOutcome.SUCCESS;
    }
}
