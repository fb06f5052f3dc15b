package com.docvault.share;

/**
 * Options for a new share. Null {@code expirationHours} uses the configured default,
 * null {@code maxAccessCount} means unlimited, null {@code blockBots} means true.
 */
public record ShareConfig(
        String createdBy,
        String resourceType,
        String password,
        Double expirationHours,
        Integer maxAccessCount,
        SharePermission permission,
        Boolean blockBots
) {

    public static ShareConfig of(String createdBy) {
        return new ShareConfig(createdBy, null, null, null, null, SharePermission.VIEW, null);
    }

    public ShareConfig withPassword(String password) {
        return new ShareConfig(createdBy, resourceType, password, expirationHours, maxAccessCount, permission, blockBots);
    }

    public ShareConfig withExpirationHours(Double hours) {
        return new ShareConfig(createdBy, resourceType, password, hours, maxAccessCount, permission, blockBots);
    }

    public ShareConfig withMaxAccessCount(Integer max) {
        return new ShareConfig(createdBy, resourceType, password, expirationHours, max, permission, blockBots);
    }

    public ShareConfig withPermission(SharePermission permission) {
        return new ShareConfig(createdBy, resourceType, password, expirationHours, maxAccessCount, permission, blockBots);
    }

    public ShareConfig withBlockBots(boolean block) {
        return new ShareConfig(createdBy, resourceType, password, expirationHours, maxAccessCount, permission, block);
    }
}
