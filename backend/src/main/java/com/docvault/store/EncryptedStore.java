package com.docvault.store;

import com.docvault.crypto.CryptoFailureException;
import com.docvault.crypto.CryptoService;
import com.docvault.crypto.EncryptedPayload;
import com.docvault.crypto.TamperedOrWrongKeyException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Encrypted key-value store.
 *
 * <p>Every value is serialised to JSON and sealed with AES-256-GCM under the store's master key
 * before it reaches the {@link StoreBackend}. The master key lives only in this instance
 * ({@link #initialize}/{@link #clear} bound its lifetime); the backend only ever holds its
 * wrapped form.
 *
 * <p><strong>Read contract:</strong> {@link #retrieve} is best-effort. Missing, expired, tampered
 * and undecodable entries all come back empty; integrity failures are logged, never thrown.
 */
public class EncryptedStore {

    private static final Logger log = LoggerFactory.getLogger(EncryptedStore.class);

    static final int SNAPSHOT_VERSION = 1;
    private static final String DEVICE_SECRET = "";
    private static final int SALT_SIZE = 16;

    private final String namespace;
    private final StoreBackend backend;
    private final CryptoService crypto;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final byte[] backupSigningKey;

    private final AtomicReference<byte[]> masterKey = new AtomicReference<>();
    private final AtomicReference<PendingUnlock> pendingUnlock = new AtomicReference<>();

    public EncryptedStore(String namespace,
                          StoreBackend backend,
                          CryptoService crypto,
                          ObjectMapper objectMapper,
                          Clock clock,
                          String backupSigningKey) {
        this.namespace = namespace;
        this.backend = backend;
        this.crypto = crypto;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.backupSigningKey = backupSigningKey.getBytes(StandardCharsets.UTF_8);
    }

    public String namespace() {
        return namespace;
    }

    public boolean isInitialized() {
        return masterKey.get() != null;
    }

    /**
     * Establishes or unlocks the master key. A no-op once the store is initialised.
     *
     * <p>A password-protected key needs the right password ({@link InvalidPasswordException}
     * otherwise). A device-wrapped key is unlocked without one; if a password is supplied it is
     * re-wrapped under that password. With no persisted key a fresh one is generated.
     */
    public Mono<Void> initialize(String password) {
        return unlockOnce(password).then();
    }

    /** Deletes every entry and the wrapped master key, and forgets the in-memory key. */
    public Mono<Void> clear() {
        return backend.deleteEntries(namespace)
                .then(backend.deleteMasterKey(namespace))
                .then(Mono.fromRunnable(() -> {
                    pendingUnlock.set(null);
                    masterKey.set(null);
                }));
    }

    public Mono<Void> store(String key, Object value) {
        return store(key, value, null);
    }

    /**
     * Encrypts {@code value} and writes it at {@code key}, replacing any previous entry in a
     * single backend write.
     */
    public Mono<Void> store(String key, Object value, Instant expiresAt) {
        requireKeyName(key);
        return masterKey()
                .map(mk -> seal(key, value, expiresAt, mk))
                .flatMap(backend::saveEntry);
    }

    /**
     * Returns the value at {@code key}, or empty if it is absent, expired (the entry is purged)
     * or cannot be decrypted or decoded (logged as an integrity warning).
     */
    public <T> Mono<T> retrieve(String key, Class<T> type) {
        requireKeyName(key);
        return masterKey().flatMap(mk -> backend.findEntry(namespace, key)
                .flatMap(entry -> {
                    Instant now = clock.instant();
                    if (entry.isExpired(now)) {
                        log.debug("Entry {} in store {} expired at {}; purging", key, namespace, entry.getExpiresAt());
                        return backend.deleteEntry(namespace, key).then(Mono.<T>empty());
                    }
                    Optional<T> value = open(entry, mk).flatMap(json -> decode(key, json, type));
                    if (value.isEmpty()) {
                        return Mono.<T>empty();
                    }
                    return backend.recordAccess(namespace, key, entry.getId(), now)
                            .thenReturn(value.get());
                }));
    }

    public Mono<Void> remove(String key) {
        requireKeyName(key);
        return backend.deleteEntry(namespace, key);
    }

    /** Purges every entry whose expiry has passed and returns how many were removed. */
    public Mono<Long> cleanupExpired() {
        Instant now = clock.instant();
        return backend.findEntries(namespace)
                .filter(entry -> entry.isExpired(now))
                .concatMap(entry -> backend.deleteEntry(namespace, entry.getKey().key()).thenReturn(entry))
                .count()
                .doOnNext(count -> {
                    if (count > 0) {
                        log.info("Purged {} expired entries from store {}", count, namespace);
                    }
                });
    }

    public Flux<String> listKeys() {
        return backend.findEntries(namespace)
                .map(entry -> entry.getKey().key())
                .sort();
    }

    public Mono<StoreInfo> storageInfo() {
        Instant now = clock.instant();
        return backend.findEntries(namespace)
                .sort((a, b) -> a.getKey().key().compareTo(b.getKey().key()))
                .collectList()
                .map(entries -> new StoreInfo(
                        isInitialized(),
                        entries.size(),
                        (int) entries.stream().filter(entry -> entry.isExpired(now)).count(),
                        entries.stream()
                                .map(entry -> new StoreInfo.Item(
                                        entry.getKey().key(),
                                        entry.getAccessCount(),
                                        entry.getLastAccessedAt(),
                                        entry.getExpiresAt()))
                                .toList()));
    }

    /**
     * Plaintext snapshot of every live entry:
     * {@code {version, exportedAt, entries: {key: {value, expiresAt}}}}. Unreadable entries are
     * skipped. The result is not encrypted; handle it like the data itself.
     */
    public Mono<String> export() {
        return masterKey().flatMap(mk -> {
            Instant now = clock.instant();
            return backend.findEntries(namespace)
                    .filter(entry -> !entry.isExpired(now))
                    .collectList()
                    .map(entries -> {
                        Map<String, ObjectNode> sorted = new TreeMap<>();
                        for (EncryptedEntry entry : entries) {
                            open(entry, mk).ifPresent(json -> {
                                ObjectNode item = objectMapper.createObjectNode();
                                item.set("value", json);
                                item.put("expiresAt", entry.getExpiresAt() != null
                                        ? entry.getExpiresAt().toString() : null);
                                sorted.put(entry.getKey().key(), item);
                            });
                        }
                        ObjectNode snapshot = objectMapper.createObjectNode();
                        snapshot.put("version", SNAPSHOT_VERSION);
                        snapshot.put("exportedAt", now.toString());
                        ObjectNode items = snapshot.putObject("entries");
                        sorted.forEach(items::set);
                        return writeJson(snapshot);
                    });
        });
    }

    /**
     * Replaces the whole store with {@code snapshot}: clears it, initialises a fresh master key
     * (protected by {@code password} when given) and stores every entry again.
     */
    public Mono<Void> importSnapshot(String snapshot, String password) {
        return Mono.fromCallable(() -> parseSnapshot(snapshot))
                .flatMap(entries -> clear()
                        .then(initialize(password))
                        .then(storeAll(entries)));
    }

    /** Snapshot plus an HMAC checksum, so a modified backup is refused on restore. */
    public Mono<String> generateBackup() {
        return export().map(data -> {
            ObjectNode backup = objectMapper.createObjectNode();
            backup.put("timestamp", clock.instant().toString());
            backup.put("version", SNAPSHOT_VERSION);
            backup.put("data", data);
            backup.put("checksum", crypto.hmac(data, backupSigningKey));
            return writeJson(backup);
        });
    }

    public Mono<Void> restoreFromBackup(String backup, String password) {
        return Mono.fromCallable(() -> {
                    JsonNode node = objectMapper.readTree(backup);
                    String data = node.path("data").asText(null);
                    String checksum = node.path("checksum").asText(null);
                    if (data == null || !crypto.verifyHmac(data, backupSigningKey, checksum)) {
                        throw new CryptoFailureException("Backup integrity check failed");
                    }
                    return data;
                })
                .onErrorMap(JsonProcessingException.class,
                        e -> new IllegalArgumentException("Backup is not valid JSON", e))
                .flatMap(data -> importSnapshot(data, password))
                .doOnSuccess(ignored -> log.info("Store {} restored from backup", namespace));
    }

    /**
     * Re-keys the store: verifies {@code oldPassword} against the persisted key (when the key is
     * password protected), exports, clears and re-imports under {@code newPassword}.
     */
    public Mono<Void> changePassword(String oldPassword, String newPassword) {
        return backend.findMasterKey(namespace)
                .flatMap(record -> unlock(record, oldPassword))
                .doOnNext(key -> masterKey.compareAndSet(null, key))
                .then(export())
                .flatMap(data -> importSnapshot(data, newPassword))
                .doOnSuccess(ignored -> log.info("Master key of store {} rotated after password change", namespace));
    }

    private Mono<byte[]> masterKey() {
        return unlockOnce(null);
    }

    /**
     * Resolves the master key, loading or creating it at most once per instance. Concurrent
     * callers with the same password share one in-flight unlock; a caller with a different
     * password waits for it to settle and then tries again.
     */
    private Mono<byte[]> unlockOnce(String password) {
        return Mono.defer(() -> {
            byte[] key = masterKey.get();
            if (key != null) {
                return Mono.just(key);
            }
            PendingUnlock pending = pendingUnlock.get();
            if (pending == null) {
                PendingUnlock attempt = new PendingUnlock(password, loadOrCreate(password));
                if (pendingUnlock.compareAndSet(null, attempt)) {
                    return attempt.key();
                }
                return unlockOnce(password);
            }
            if (Objects.equals(pending.password(), password)) {
                return pending.key();
            }
            return pending.key()
                    .onErrorResume(e -> Mono.empty())
                    .then(Mono.defer(() -> unlockOnce(password)));
        });
    }

    private Mono<byte[]> loadOrCreate(String password) {
        return backend.findMasterKey(namespace)
                .flatMap(record -> unlock(record, password))
                .switchIfEmpty(Mono.defer(() -> createMasterKey(password)))
                .map(key -> {
                    masterKey.compareAndSet(null, key);
                    return masterKey.get();
                })
                .doFinally(signal -> pendingUnlock.set(null))
                .cache();
    }

    private Mono<byte[]> unlock(MasterKeyRecord record, String password) {
        return Mono.fromCallable(() -> {
            if (record.isPasswordProtected() && password == null) {
                throw new InvalidPasswordException("Store " + namespace + " is password protected");
            }
            String secret = record.isPasswordProtected() ? password : DEVICE_SECRET;
            byte[] wrappingKey = crypto.deriveKeyFromPassword(
                    secret, Base64.getDecoder().decode(record.getSalt()), record.getIterations());
            EncryptedPayload wrapped = new EncryptedPayload(
                    record.getIv(), record.getWrappedKey(), record.getAuthTag(), CryptoService.AES_GCM);
            try {
                return crypto.decrypt(wrapped, wrappingKey);
            } catch (TamperedOrWrongKeyException e) {
                if (record.isPasswordProtected()) {
                    throw new InvalidPasswordException("Invalid password");
                }
                throw new CryptoFailureException("Master key record of store " + namespace + " is corrupted", e);
            }
        }).subscribeOn(Schedulers.boundedElastic())
                .flatMap(key -> {
                    if (!record.isPasswordProtected() && password != null) {
                        log.info("Protecting master key of store {} with a password", namespace);
                        return persistMasterKey(key, password).thenReturn(key);
                    }
                    return Mono.just(key);
                });
    }

    private Mono<byte[]> createMasterKey(String password) {
        return Mono.fromCallable(crypto::generateSymmetricKey)
                .flatMap(key -> persistMasterKey(key, password).thenReturn(key))
                .doOnNext(key -> {
                    if (password == null) {
                        log.warn("Store {} initialised without a password; its master key is only device-wrapped", namespace);
                    } else {
                        log.info("Store {} initialised with a password-protected master key", namespace);
                    }
                });
    }

    private Mono<Void> persistMasterKey(byte[] key, String password) {
        return Mono.fromCallable(() -> {
            byte[] salt = crypto.randomBytes(SALT_SIZE);
            int iterations = crypto.passwordIterations();
            byte[] wrappingKey = crypto.deriveKeyFromPassword(
                    password != null ? password : DEVICE_SECRET, salt, iterations);
            EncryptedPayload wrapped = crypto.encrypt(key, wrappingKey);

            MasterKeyRecord record = new MasterKeyRecord();
            record.setNamespace(namespace);
            record.setWrappedKey(wrapped.ciphertext());
            record.setIv(wrapped.iv());
            record.setAuthTag(wrapped.tag());
            record.setSalt(Base64.getEncoder().encodeToString(salt));
            record.setIterations(iterations);
            record.setPasswordProtected(password != null);
            record.setCreatedAt(clock.instant());
            return record;
        }).subscribeOn(Schedulers.boundedElastic())
                .flatMap(backend::saveMasterKey);
    }

    private EncryptedEntry seal(String key, Object value, Instant expiresAt, byte[] mk) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value for key " + key + " cannot be serialised", e);
        }
        EncryptedPayload payload = crypto.encrypt(json, mk);
        Instant now = clock.instant();

        EncryptedEntry entry = new EncryptedEntry();
        entry.setKey(new EntryKey(namespace, key));
        entry.setId(crypto.generateSecureId("entry"));
        entry.setCiphertext(payload.ciphertext());
        entry.setIv(payload.iv());
        entry.setAuthTag(payload.tag());
        entry.setAlgorithm(payload.algorithm());
        entry.setExpiresAt(expiresAt);
        entry.setAccessCount(0);
        entry.setLastAccessedAt(now);
        entry.setCreatedAt(now);
        return entry;
    }

    private Optional<JsonNode> open(EncryptedEntry entry, byte[] mk) {
        String key = entry.getKey().key();
        try {
            EncryptedPayload payload = new EncryptedPayload(
                    entry.getIv(), entry.getCiphertext(), entry.getAuthTag(), entry.getAlgorithm());
            return Optional.of(objectMapper.readTree(crypto.decrypt(payload, mk)));
        } catch (CryptoFailureException e) {
            log.warn("Integrity check failed for entry {} in store {}; treating it as absent: {}",
                    key, namespace, e.getMessage());
        } catch (IOException e) {
            log.warn("Entry {} in store {} does not hold valid JSON; treating it as absent", key, namespace);
        }
        return Optional.empty();
    }

    private <T> Optional<T> decode(String key, JsonNode json, Class<T> type) {
        try {
            return Optional.ofNullable(objectMapper.treeToValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Entry {} in store {} cannot be read as {}: {}",
                    key, namespace, type.getSimpleName(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Map<String, SnapshotItem> parseSnapshot(String snapshot) {
        JsonNode root;
        try {
            root = objectMapper.readTree(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Snapshot is not valid JSON", e);
        }
        JsonNode entries = root.path("entries");
        if (!entries.isObject()) {
            throw new IllegalArgumentException("Snapshot has no entries object");
        }
        Map<String, SnapshotItem> items = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = entries.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode expires = field.getValue().path("expiresAt");
            Instant expiresAt = expires.isTextual() ? Instant.parse(expires.asText()) : null;
            items.put(field.getKey(), new SnapshotItem(field.getValue().path("value"), expiresAt));
        }
        return items;
    }

    private Mono<Void> storeAll(Map<String, SnapshotItem> items) {
        Instant now = clock.instant();
        return Flux.fromIterable(items.entrySet())
                .filter(item -> item.getValue().expiresAt() == null || item.getValue().expiresAt().isAfter(now))
                .concatMap(item -> store(item.getKey(), item.getValue().value(), item.getValue().expiresAt()))
                .then();
    }

    private String writeJson(JsonNode node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Snapshot serialisation failed", e);
        }
    }

    private static void requireKeyName(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Store key must not be blank");
        }
    }

    private record SnapshotItem(JsonNode value, Instant expiresAt) {}

    private record PendingUnlock(String password, Mono<byte[]> key) {}
}
