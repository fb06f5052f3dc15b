package com.docvault.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local backend for tests and single-user local mode. Keeps copies so callers never
 * share mutable rows with the map.
 */
public class InMemoryStoreBackend implements StoreBackend {

    private final Map<EntryKey, EncryptedEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, MasterKeyRecord> masterKeys = new ConcurrentHashMap<>();

    @Override
    public Mono<EncryptedEntry> findEntry(String namespace, String key) {
        return Mono.fromSupplier(() -> {
            EncryptedEntry entry = entries.get(new EntryKey(namespace, key));
            return entry != null ? entry.copy() : null;
        });
    }

    @Override
    public Flux<EncryptedEntry> findEntries(String namespace) {
        return Flux.defer(() -> {
            List<EncryptedEntry> matches = new ArrayList<>();
            entries.forEach((key, entry) -> {
                if (key.namespace().equals(namespace)) {
                    matches.add(entry.copy());
                }
            });
            return Flux.fromIterable(matches);
        });
    }

    @Override
    public Mono<Void> saveEntry(EncryptedEntry entry) {
        return Mono.fromRunnable(() -> entries.put(entry.getKey(), entry.copy()));
    }

    @Override
    public Mono<Void> deleteEntry(String namespace, String key) {
        return Mono.fromRunnable(() -> entries.remove(new EntryKey(namespace, key)));
    }

    @Override
    public Mono<Void> recordAccess(String namespace, String key, String entryId, Instant accessedAt) {
        return Mono.fromRunnable(() -> entries.computeIfPresent(new EntryKey(namespace, key), (k, entry) -> {
            if (entry.getId().equals(entryId)) {
                entry.setAccessCount(entry.getAccessCount() + 1);
                entry.setLastAccessedAt(accessedAt);
            }
            return entry;
        }));
    }

    @Override
    public Mono<Void> deleteEntries(String namespace) {
        return Mono.fromRunnable(() -> entries.keySet().removeIf(key -> key.namespace().equals(namespace)));
    }

    @Override
    public Mono<MasterKeyRecord> findMasterKey(String namespace) {
        return Mono.fromSupplier(() -> masterKeys.get(namespace));
    }

    @Override
    public Mono<Void> saveMasterKey(MasterKeyRecord record) {
        return Mono.fromRunnable(() -> masterKeys.put(record.getNamespace(), record));
    }

    @Override
    public Mono<Void> deleteMasterKey(String namespace) {
        return Mono.fromRunnable(() -> masterKeys.remove(namespace));
    }

    /** Direct row access for inspection. */
    public EncryptedEntry rawEntry(String namespace, String key) {
        EncryptedEntry entry = entries.get(new EntryKey(namespace, key));
        return entry != null ? entry.copy() : null;
    }

    public void replaceRawEntry(EncryptedEntry entry) {
        entries.put(entry.getKey(), entry.copy());
    }
}
