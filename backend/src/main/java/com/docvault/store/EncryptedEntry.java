package com.docvault.store;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

import java.time.Instant;

/**
 * One encrypted value in the store. The plaintext never reaches this row: {@code ciphertext},
 * {@code iv} and {@code authTag} are written together or not at all.
 */
@Table("encrypted_entries")
public class EncryptedEntry {

    @PrimaryKey
    private EntryKey key;

    @Column("id")
    private String id;

    @Column("ciphertext")
    private String ciphertext;

    @Column("iv")
    private String iv;

    @Column("auth_tag")
    private String authTag;

    @Column("algorithm")
    private String algorithm;

    /** Null means the entry never expires. */
    @Column("expires_at")
    private Instant expiresAt;

    @Column("access_count")
    private int accessCount;

    @Column("last_accessed_at")
    private Instant lastAccessedAt;

    @Column("created_at")
    private Instant createdAt;

    public EncryptedEntry() {}

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public EncryptedEntry copy() {
        EncryptedEntry copy = new EncryptedEntry();
        copy.key = key;
        copy.id = id;
        copy.ciphertext = ciphertext;
        copy.iv = iv;
        copy.authTag = authTag;
        copy.algorithm = algorithm;
        copy.expiresAt = expiresAt;
        copy.accessCount = accessCount;
        copy.lastAccessedAt = lastAccessedAt;
        copy.createdAt = createdAt;
        return copy;
    }

    // Getters & Setters
    public EntryKey getKey() { return key; }
    public void setKey(EntryKey key) { this.key = key; }
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getCiphertext() { return ciphertext; }
    public void setCiphertext(String ciphertext) { this.ciphertext = ciphertext; }
    public String getIv() { return iv; }
    public void setIv(String iv) { this.iv = iv; }
    public String getAuthTag() { return authTag; }
    public void setAuthTag(String authTag) { this.authTag = authTag; }
    public String getAlgorithm() { return algorithm; }
    public void setAlgorithm(String algorithm) { this.algorithm = algorithm; }
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
    public int getAccessCount() { return accessCount; }
    public void setAccessCount(int accessCount) { this.accessCount = accessCount; }
    public Instant getLastAccessedAt() { return lastAccessedAt; }
    public void setLastAccessedAt(Instant lastAccessedAt) { this.lastAccessedAt = lastAccessedAt; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
