package com.docvault.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/** Stores entries and master keys in Cassandra through the reactive repositories. */
public class CassandraStoreBackend implements StoreBackend {

    private final EncryptedEntryRepository entryRepository;
    private final MasterKeyRepository masterKeyRepository;

    public CassandraStoreBackend(EncryptedEntryRepository entryRepository,
                                 MasterKeyRepository masterKeyRepository) {
        this.entryRepository = entryRepository;
        this.masterKeyRepository = masterKeyRepository;
    }

    @Override
    public Mono<EncryptedEntry> findEntry(String namespace, String key) {
        return entryRepository.findById(new EntryKey(namespace, key));
    }

    @Override
    public Flux<EncryptedEntry> findEntries(String namespace) {
        return entryRepository.findAllByKeyNamespace(namespace);
    }

    @Override
    public Mono<Void> saveEntry(EncryptedEntry entry) {
        return entryRepository.save(entry).then();
    }

    @Override
    public Mono<Void> deleteEntry(String namespace, String key) {
        return entryRepository.deleteById(new EntryKey(namespace, key));
    }

    @Override
    public Mono<Void> recordAccess(String namespace, String key, String entryId, Instant accessedAt) {
        return entryRepository.findById(new EntryKey(namespace, key))
                .filter(entry -> entry.getId().equals(entryId))
                .flatMap(entry -> {
                    entry.setAccessCount(entry.getAccessCount() + 1);
                    entry.setLastAccessedAt(accessedAt);
                    return entryRepository.save(entry);
                })
                .then();
    }

    @Override
    public Mono<Void> deleteEntries(String namespace) {
        return entryRepository.deleteAll(entryRepository.findAllByKeyNamespace(namespace));
    }

    @Override
    public Mono<MasterKeyRecord> findMasterKey(String namespace) {
        return masterKeyRepository.findById(namespace);
    }

    @Override
    public Mono<Void> saveMasterKey(MasterKeyRecord record) {
        return masterKeyRepository.save(record).then();
    }

    @Override
    public Mono<Void> deleteMasterKey(String namespace) {
        return masterKeyRepository.deleteById(namespace);
    }
}
