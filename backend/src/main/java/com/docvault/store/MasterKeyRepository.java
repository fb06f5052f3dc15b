package com.docvault.store;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MasterKeyRepository extends ReactiveCassandraRepository<MasterKeyRecord, String> {
    // Inherits: findById(namespace), save(record), deleteById(namespace)
}
