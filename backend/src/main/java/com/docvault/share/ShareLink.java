package com.docvault.share;

import java.time.Instant;

/** What the share creator hands out. {@code accessKey} is the raw token and is shown only here. */
public record ShareLink(
        String id,
        String url,
        Instant expiresAt,
        String accessKey,
        boolean passwordProtected
) {
}
