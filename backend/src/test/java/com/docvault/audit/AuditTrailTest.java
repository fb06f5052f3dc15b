package com.docvault.audit;

import com.docvault.crypto.CryptoService;
import com.docvault.store.EncryptedEntry;
import com.docvault.store.EncryptedStore;
import com.docvault.store.InMemoryStoreBackend;
import com.docvault.support.MutableClock;
import com.docvault.support.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Base64;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditTrailTest {

    private MutableClock clock;
    private InMemoryStoreBackend backend;
    private EncryptedStore store;
    private CryptoService crypto;

    @BeforeEach
    void setup() {
        clock = MutableClock.startingAt("2026-05-10T08:00:00Z");
        crypto = TestStores.crypto(clock);
        backend = new InMemoryStoreBackend();
        store = TestStores.store("audit", backend, crypto, clock);
    }

    @Test
    void entriesAreAppendedInOrderAndPersistedEncrypted() {
        AuditTrail trail = new AuditTrail(store, crypto, clock, 100);

        StepVerifier.create(trail.record("admin", AuditAction.PERMISSION_GRANTED, "user-1",
                        AuditTrail.details("permissionId", "read_document")))
                .assertNext(entry -> {
                    assertTrue(entry.id().startsWith("audit_"));
                    assertEquals(clock.instant(), entry.timestamp());
                })
                .verifyComplete();

        clock.advance(Duration.ofMinutes(1));
        trail.record("admin", AuditAction.SHARE_REVOKED, "share-9", Map.of()).block();

        StepVerifier.create(trail.entries().map(AuditEntry::action))
                .expectNext(AuditAction.PERMISSION_GRANTED, AuditAction.SHARE_REVOKED)
                .verifyComplete();
        StepVerifier.create(trail.entriesFor("user-1"))
                .assertNext(entry -> assertEquals(Map.of("permissionId", "read_document"), entry.details()))
                .verifyComplete();
    }

    @Test
    void oldestEntriesAreDroppedBeyondTheCap() {
        AuditTrail trail = new AuditTrail(store, crypto, clock, 3);

        Flux.range(1, 5)
                .concatMap(i -> trail.record("admin", AuditAction.ROLE_ASSIGNED, "user-" + i, null))
                .blockLast();

        StepVerifier.create(trail.entries().map(AuditEntry::target))
                .expectNext("user-3", "user-4", "user-5")
                .verifyComplete();
    }

    @Test
    void unreadableEntryIsSkippedWithoutLosingTheRest() {
        AuditTrail trail = new AuditTrail(store, crypto, clock, 100);
        Flux.range(1, 3)
                .concatMap(i -> trail.record("admin", AuditAction.ACL_CREATED, "doc-" + i, null))
                .blockLast();

        String secondKey = store.listKeys().skip(1).blockFirst();
        EncryptedEntry row = backend.rawEntry("audit", secondKey);
        byte[] tag = Base64.getDecoder().decode(row.getAuthTag());
        tag[0] ^= 0x01;
        row.setAuthTag(Base64.getEncoder().encodeToString(tag));
        backend.replaceRawEntry(row);

        trail.record("admin", AuditAction.ACL_CREATED, "doc-4", null).block();

        StepVerifier.create(trail.entries().map(AuditEntry::target))
                .expectNext("doc-1", "doc-3", "doc-4")
                .verifyComplete();
    }

    @Test
    void detailsSkipNullValues() {
        assertEquals(Map.of("a", "1"), AuditTrail.details("a", "1", "b", null));
        assertThrows(IllegalArgumentException.class, () -> AuditTrail.details("dangling"));
    }
}
