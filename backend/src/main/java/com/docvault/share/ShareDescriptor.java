package com.docvault.share;

import com.docvault.crypto.PasswordHash;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A share link's persisted state. {@code accessCount} counts successful accesses and always
 * equals {@code archivedAccessCount} plus the successes still in {@code accessLog}.
 */
public class ShareDescriptor {

    private String id;
    private String resourceId;
    private String resourceType;
    private String token;
    private PasswordHash passwordHash;
    private SharePermission permission;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant expiresAt;
    private Integer maxAccessCount;
    private int accessCount;
    private int archivedAccessCount;
    private boolean active;
    private ShareStatus status;
    private boolean blockBots;
    private List<AccessLogEntry> accessLog = new ArrayList<>();

    @JsonIgnore
    public boolean isPasswordProtected() {
        return passwordHash != null;
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    @JsonIgnore
    public boolean isLimitReached() {
        return maxAccessCount != null && accessCount >= maxAccessCount;
    }

    /** Moves an active share to a terminal status. Terminal statuses never change. */
    public void terminate(ShareStatus terminal, Instant now) {
        if (status == ShareStatus.ACTIVE) {
            status = terminal;
        }
        active = false;
        updatedAt = now;
    }

    public AccessLogEntry lastLogEntry() {
        return accessLog.isEmpty() ? null : accessLog.get(accessLog.size() - 1);
    }

    // Getters & Setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getResourceId() { return resourceId; }
    public void setResourceId(String resourceId) { this.resourceId = resourceId; }
    public String getResourceType() { return resourceType; }
    public void setResourceType(String resourceType) { this.resourceType = resourceType; }
    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }
    public PasswordHash getPasswordHash() { return passwordHash; }
    public void setPasswordHash(PasswordHash passwordHash) { this.passwordHash = passwordHash; }
    public SharePermission getPermission() { return permission; }
    public void setPermission(SharePermission permission) { this.permission = permission; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
    public Integer getMaxAccessCount() { return maxAccessCount; }
    public void setMaxAccessCount(Integer maxAccessCount) { this.maxAccessCount = maxAccessCount; }
    public int getAccessCount() { return accessCount; }
    public void setAccessCount(int accessCount) { this.accessCount = accessCount; }
    public int getArchivedAccessCount() { return archivedAccessCount; }
    public void setArchivedAccessCount(int archivedAccessCount) { this.archivedAccessCount = archivedAccessCount; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public ShareStatus getStatus() { return status; }
    public void setStatus(ShareStatus status) { this.status = status; }
    public boolean isBlockBots() { return blockBots; }
    public void setBlockBots(boolean blockBots) { this.blockBots = blockBots; }
    public List<AccessLogEntry> getAccessLog() { return accessLog; }
    public void setAccessLog(List<AccessLogEntry> accessLog) { this.accessLog = accessLog != null ? new ArrayList<>(accessLog) : new ArrayList<>(); }
}
