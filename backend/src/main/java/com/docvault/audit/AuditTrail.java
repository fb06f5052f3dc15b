package com.docvault.audit;

import com.docvault.crypto.CryptoService;
import com.docvault.store.EncryptedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only audit trail for grants, revocations, ACL and policy changes, and share
 * revocations. Access checks themselves are not audited.
 *
 * <p>Each entry is kept encrypted in the store under its own key, ordered by timestamp, and the
 * trail is bounded to the newest {@code maxEntries}. An entry that cannot be read back is
 * skipped on its own. Every entry is also written to the application log.
 */
@Service
public class AuditTrail {

    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    static final String ENTRY = "audit:";

    private final EncryptedStore store;
    private final CryptoService crypto;
    private final Clock clock;
    private final int maxEntries;
    private final AtomicLong sequence = new AtomicLong();

    public AuditTrail(EncryptedStore store,
                      CryptoService crypto,
                      Clock clock,
                      @Value("${docvault.audit.max-entries:1000}") int maxEntries) {
        this.store = store;
        this.crypto = crypto;
        this.clock = clock;
        this.maxEntries = maxEntries;
    }

    public Mono<AuditEntry> record(String actor, AuditAction action, String target, Map<String, String> details) {
        return Mono.defer(() -> {
            AuditEntry entry = new AuditEntry(
                    crypto.generateSecureId("audit"),
                    actor,
                    action,
                    target,
                    withoutNulls(details),
                    clock.instant());
            log.info("Audit: actor={}, action={}, target={}, details={}",
                    actor, action.code(), target, entry.details());
            String key = String.format("%s%013d-%06d", ENTRY, entry.timestamp().toEpochMilli(),
                    sequence.getAndIncrement() % 1_000_000);
            return store.store(key, entry)
                    .then(trim())
                    .thenReturn(entry);
        });
    }

    /** Builds a details map from alternating keys and values, skipping null values. */
    public static Map<String, String> details(String... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Details need key/value pairs");
        }
        Map<String, String> details = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            if (keysAndValues[i + 1] != null) {
                details.put(keysAndValues[i], keysAndValues[i + 1]);
            }
        }
        return details;
    }

    /** Entries oldest first. */
    public Flux<AuditEntry> entries() {
        return entryKeys()
                .concatMap(key -> store.retrieve(key, AuditEntry.class)
                        .switchIfEmpty(Mono.fromRunnable(() ->
                                log.error("Audit entry {} could not be read back; skipping it", key))));
    }

    public Flux<AuditEntry> entriesFor(String target) {
        return entries().filter(entry -> entry.target().equals(target));
    }

    private Flux<String> entryKeys() {
        return store.listKeys().filter(key -> key.startsWith(ENTRY));
    }

    private Mono<Void> trim() {
        return entryKeys().collectList()
                .flatMapMany(keys -> Flux.fromIterable(keys.subList(0, Math.max(0, keys.size() - maxEntries))))
                .concatMap(store::remove)
                .then();
    }

    private static Map<String, String> withoutNulls(Map<String, String> details) {
        Map<String, String> copy = new LinkedHashMap<>();
        if (details != null) {
            details.forEach((key, value) -> {
                if (value != null) {
                    copy.put(key, value);
                }
            });
        }
        return Collections.unmodifiableMap(copy);
    }
}
