package com.docvault.share;

import java.time.Instant;

public record ResourceTombstone(String resourceId, String deletedBy, Instant deletedAt) {
}
