package com.docvault.store;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

import java.time.Instant;

/**
 * The persisted, wrapped form of a store's master key. The key itself is AES-GCM encrypted under
 * a PBKDF2 key: derived from the user's password when {@code passwordProtected}, otherwise from
 * an empty secret and the salt (opaque to casual inspection only).
 */
@Table("master_keys")
public class MasterKeyRecord {

    @PrimaryKey
    private String namespace;

    @Column("wrapped_key")
    private String wrappedKey;

    @Column("iv")
    private String iv;

    @Column("auth_tag")
    private String authTag;

    @Column("salt")
    private String salt;

    @Column("iterations")
    private int iterations;

    @Column("password_protected")
    private boolean passwordProtected;

    @Column("created_at")
    private Instant createdAt;

    public MasterKeyRecord() {}

    // Getters & Setters
    public String getNamespace() { return namespace; }
    public void setNamespace(String namespace) { this.namespace = namespace; }
    public String getWrappedKey() { return wrappedKey; }
    public void setWrappedKey(String wrappedKey) { this.wrappedKey = wrappedKey; }
    public String getIv() { return iv; }
    public void setIv(String iv) { this.iv = iv; }
    public String getAuthTag() { return authTag; }
    public void setAuthTag(String authTag) { this.authTag = authTag; }
    public String getSalt() { return salt; }
    public void setSalt(String salt) { this.salt = salt; }
    public int getIterations() { return iterations; }
    public void setIterations(int iterations) { this.iterations = iterations; }
    public boolean isPasswordProtected() { return passwordProtected; }
    public void setPasswordProtected(boolean passwordProtected) { this.passwordProtected = passwordProtected; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
