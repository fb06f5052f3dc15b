package com.docvault.share;

import com.docvault.audit.AuditAction;
import com.docvault.audit.AuditTrail;
import com.docvault.store.EncryptedStore;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

/**
 * Documents live outside this service, so a resource is assumed to exist until its owner
 * reports it deleted. Deletions are kept as tombstones in the encrypted store.
 */
@Component
public class TombstoneResourceRegistry implements ResourceRegistry {

    static final String TOMBSTONE = "resource-tombstone:";

    private final EncryptedStore store;
    private final AuditTrail auditTrail;
    private final Clock clock;

    public TombstoneResourceRegistry(EncryptedStore store, AuditTrail auditTrail, Clock clock) {
        this.store = store;
        this.auditTrail = auditTrail;
        this.clock = clock;
    }

    @Override
    public Mono<Boolean> exists(String resourceId) {
        return store.retrieve(TOMBSTONE + resourceId, ResourceTombstone.class)
                .hasElement()
                .map(deleted -> !deleted);
    }

    @Override
    public Mono<Void> markDeleted(String resourceId, String deletedBy) {
        return Mono.defer(() -> store.store(TOMBSTONE + resourceId,
                        new ResourceTombstone(resourceId, deletedBy, clock.instant())))
                .then(auditTrail.record(deletedBy, AuditAction.RESOURCE_DELETED, resourceId, Map.of()))
                .then();
    }
}
