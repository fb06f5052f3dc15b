package com.docvault.share;

import java.time.Instant;

/** Outward view of a share without its token, password hash or log. */
public record ShareSummary(
        String id,
        String resourceId,
        SharePermission permission,
        String createdBy,
        Instant createdAt,
        Instant expiresAt,
        Integer maxAccessCount,
        int accessCount,
        ShareStatus status,
        boolean active,
        boolean passwordProtected
) {

    public static ShareSummary of(ShareDescriptor share) {
        if (share == null) {
            return null;
        }
        return new ShareSummary(share.getId(), share.getResourceId(), share.getPermission(), share.getCreatedBy(),
                share.getCreatedAt(), share.getExpiresAt(), share.getMaxAccessCount(), share.getAccessCount(),
                share.getStatus(), share.isActive(), share.isPasswordProtected());
    }
}
