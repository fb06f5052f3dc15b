package com.docvault.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Persistence substrate under {@link EncryptedStore}. Sees only encrypted rows and wrapped
 * master keys. A single {@code saveEntry} is atomic per (namespace, key).
 */
public interface StoreBackend {

    Mono<EncryptedEntry> findEntry(String namespace, String key);

    Flux<EncryptedEntry> findEntries(String namespace);

    Mono<Void> saveEntry(EncryptedEntry entry);

    Mono<Void> deleteEntry(String namespace, String key);

    /**
     * Bumps the access counters of the row at {@code key}, but only while it is still the row
     * with {@code entryId}; a concurrent overwrite is never reverted.
     */
    Mono<Void> recordAccess(String namespace, String key, String entryId, Instant accessedAt);

    Mono<Void> deleteEntries(String namespace);

    Mono<MasterKeyRecord> findMasterKey(String namespace);

    Mono<Void> saveMasterKey(MasterKeyRecord record);

    Mono<Void> deleteMasterKey(String namespace);
}
