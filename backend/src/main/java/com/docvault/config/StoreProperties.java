package com.docvault.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param backend {@code cassandra} or {@code memory}
 * @param namespace partition that isolates this store's entries and master key
 * @param password master-key password; when absent the key is only device-wrapped
 * @param backupSigningKey HMAC key for backup checksums
 */
@ConfigurationProperties(prefix = "docvault.store")
public record StoreProperties(
        @DefaultValue("cassandra") String backend,
        @DefaultValue("docvault") String namespace,
        String password,
        @DefaultValue("docvault-backup") String backupSigningKey) {}
