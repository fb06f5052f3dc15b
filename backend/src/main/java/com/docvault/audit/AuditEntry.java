package com.docvault.audit;

import java.time.Instant;
import java.util.Map;

/** Immutable record of one access-control mutation. */
public record AuditEntry(
        String id,
        String actor,
        AuditAction action,
        String target,
        Map<String, String> details,
        Instant timestamp
) {}
