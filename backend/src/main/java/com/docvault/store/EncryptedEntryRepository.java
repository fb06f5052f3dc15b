package com.docvault.store;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface EncryptedEntryRepository extends ReactiveCassandraRepository<EncryptedEntry, EntryKey> {

    Flux<EncryptedEntry> findAllByKeyNamespace(String namespace);
}
