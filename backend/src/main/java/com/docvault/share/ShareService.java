package com.docvault.share;

import com.docvault.access.AccessCheck;
import com.docvault.access.AccessEvaluator;
import com.docvault.audit.AuditAction;
import com.docvault.audit.AuditTrail;
import com.docvault.crypto.CryptoService;
import com.docvault.crypto.PasswordHash;
import com.docvault.exception.InvalidStateException;
import com.docvault.exception.ResourceNotFoundException;
import com.docvault.store.EncryptedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.docvault.audit.AuditTrail.details;

/**
 * Share links: creation, validation, use, revocation and the housekeeping around them.
 *
 * <p>A share is {@code active} until it becomes {@code expired}, {@code access_exhausted} or
 * {@code revoked}; those states are terminal. Denials are returned as {@link ShareFailure}
 * reasons, never thrown. Each share's access log is the source of truth for analytics;
 * {@code accessCount} is a running total that {@link #reconcileAccessCount} can rebuild.
 */
@Service
@EnableConfigurationProperties(SharingProperties.class)
public class ShareService {

    private static final Logger log = LoggerFactory.getLogger(ShareService.class);

    static final String SHARE = "share:";
    static final String TOKEN_INDEX = "share-token:";
    static final int TOKEN_BYTES = 32;
    static final String DEFAULT_RESOURCE_TYPE = "document";
    private static final double MILLIS_PER_HOUR = 3_600_000d;

    private final EncryptedStore store;
    private final CryptoService crypto;
    private final AccessEvaluator evaluator;
    private final ResourceRegistry resources;
    private final AuditTrail auditTrail;
    private final Clock clock;
    private final SharingProperties properties;

    public ShareService(EncryptedStore store,
                        CryptoService crypto,
                        AccessEvaluator evaluator,
                        ResourceRegistry resources,
                        AuditTrail auditTrail,
                        Clock clock,
                        SharingProperties properties) {
        this.store = store;
        this.crypto = crypto;
        this.evaluator = evaluator;
        this.resources = resources;
        this.auditTrail = auditTrail;
        this.clock = clock;
        this.properties = properties;
    }

    public Mono<ShareDescriptor> createShare(String resourceId, ShareConfig config) {
        requireText(resourceId, "resourceId");
        requireText(config.createdBy(), "createdBy");
        Duration lifetime = lifetime(config.expirationHours());
        if (config.maxAccessCount() != null && config.maxAccessCount() < 1) {
            throw new IllegalArgumentException("maxAccessCount must be at least 1");
        }

        return hash(config.password())
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(passwordHash -> {
                    Instant now = clock.instant();
                    ShareDescriptor share = new ShareDescriptor();
                    share.setId(crypto.generateSecureId("share"));
                    share.setResourceId(resourceId);
                    share.setResourceType(config.resourceType() != null ? config.resourceType() : DEFAULT_RESOURCE_TYPE);
                    share.setToken(crypto.generateSecureToken(TOKEN_BYTES));
                    share.setPasswordHash(passwordHash.orElse(null));
                    share.setPermission(config.permission() != null ? config.permission() : SharePermission.VIEW);
                    share.setCreatedBy(config.createdBy());
                    share.setCreatedAt(now);
                    share.setUpdatedAt(now);
                    share.setExpiresAt(now.plus(lifetime));
                    share.setMaxAccessCount(config.maxAccessCount());
                    share.setActive(true);
                    share.setStatus(ShareStatus.ACTIVE);
                    share.setBlockBots(config.blockBots() == null || config.blockBots());

                    return save(share)
                            .then(index(share))
                            .then(auditTrail.record(share.getCreatedBy(), AuditAction.SHARE_CREATED, share.getId(),
                                    details("resourceId", resourceId,
                                            "permission", share.getPermission().code(),
                                            "expiresAt", share.getExpiresAt().toString(),
                                            "passwordProtected", Boolean.toString(share.isPasswordProtected()))))
                            .thenReturn(share);
                });
    }

    public Mono<ShareLink> createShareLink(String resourceId, ShareConfig config) {
        return createShare(resourceId, config).map(this::toLink);
    }

    public ShareLink toLink(ShareDescriptor share) {
        return new ShareLink(share.getId(), shareUrl(share), share.getExpiresAt(), share.getToken(),
                share.isPasswordProtected());
    }

    /** {@code <base-url>/shared/<id>?token=<token>}, plus {@code &protected=true} when a password is set. */
    public String shareUrl(ShareDescriptor share) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(properties.baseUrl())
                .path("/shared/{id}")
                .queryParam("token", share.getToken());
        if (share.isPasswordProtected()) {
            builder.queryParam("protected", true);
        }
        return builder.buildAndExpand(share.getId()).toUriString();
    }

    public Optional<ShareUrl> parseShareUrl(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        UriComponents components;
        try {
            components = UriComponentsBuilder.fromUriString(url).build();
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable share URL {}", url);
            return Optional.empty();
        }
        List<String> segments = components.getPathSegments();
        int marker = segments.indexOf("shared");
        String token = components.getQueryParams().getFirst("token");
        if (marker < 0 || marker + 1 >= segments.size() || token == null || token.isBlank()) {
            return Optional.empty();
        }
        boolean passwordProtected = "true".equalsIgnoreCase(components.getQueryParams().getFirst("protected"));
        return Optional.of(new ShareUrl(segments.get(marker + 1), token, passwordProtected));
    }

    /**
     * Read-only check, first failure wins: exists, still active, not expired, under its access
     * limit, password supplied and correct.
     */
    public Mono<ShareValidation> validateShare(String token, String password) {
        return findByToken(token)
                .flatMap(share -> validate(share, password))
                .defaultIfEmpty(ShareValidation.failed(null, ShareFailure.NOT_FOUND));
    }

    /**
     * Validates, then refuses bots (when the share blocks them), actions beyond the share's
     * permission, deleted resources and principals explicitly denied by an ACL entry or policy.
     * Every attempt on an existing share is logged; only successes move the counters.
     */
    public Mono<ShareAccessResult> accessShare(String token, AccessAttempt attempt) {
        return findByToken(token)
                .flatMap(share -> firstFailure(share, attempt)
                        .flatMap(failure -> recordFailure(share, attempt, failure))
                        .switchIfEmpty(Mono.defer(() -> recordSuccess(share, attempt))))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.debug("Share access with unknown token by {}", attempt.principal());
                    return ShareAccessResult.failed(null, ShareFailure.NOT_FOUND);
                }));
    }

    private Mono<ShareValidation> validate(ShareDescriptor share, String password) {
        Optional<ShareFailure> stateFailure = stateFailure(share, clock.instant());
        if (stateFailure.isPresent()) {
            return Mono.just(ShareValidation.failed(share, stateFailure.get()));
        }
        if (!share.isPasswordProtected()) {
            return Mono.just(ShareValidation.ok(share));
        }
        if (password == null || password.isEmpty()) {
            return Mono.just(ShareValidation.failed(share, ShareFailure.REQUIRES_PASSWORD));
        }
        return Mono.fromCallable(() -> crypto.verifyPassword(password, share.getPasswordHash()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(matches -> matches
                        ? ShareValidation.ok(share)
                        : ShareValidation.failed(share, ShareFailure.INVALID_CREDENTIALS));
    }

    private static Optional<ShareFailure> stateFailure(ShareDescriptor share, Instant now) {
        if (share.getStatus() == ShareStatus.REVOKED || (!share.isActive() && share.getStatus() == ShareStatus.ACTIVE)) {
            return Optional.of(ShareFailure.REVOKED);
        }
        if (share.getStatus() == ShareStatus.EXPIRED || share.isExpiredAt(now)) {
            return Optional.of(ShareFailure.EXPIRED);
        }
        if (share.getStatus() == ShareStatus.ACCESS_EXHAUSTED || share.isLimitReached()) {
            return Optional.of(ShareFailure.ACCESS_EXHAUSTED);
        }
        return Optional.empty();
    }

    private Mono<ShareFailure> firstFailure(ShareDescriptor share, AccessAttempt attempt) {
        return validate(share, attempt.password())
                .flatMap(validation -> validation.valid() ? Mono.<ShareFailure>empty() : Mono.just(validation.reason()))
                .switchIfEmpty(Mono.defer(() -> usageFailure(share, attempt)));
    }

    private Mono<ShareFailure> usageFailure(ShareDescriptor share, AccessAttempt attempt) {
        if (share.isBlockBots() && DeviceType.isBot(attempt.userAgent())) {
            return Mono.just(ShareFailure.BOT_BLOCKED);
        }
        if (!share.getPermission().allows(attempt.action())) {
            return Mono.just(ShareFailure.PERMISSION_DENIED);
        }
        return resources.exists(share.getResourceId())
                .flatMap(exists -> exists ? principalOverride(share, attempt) : Mono.just(ShareFailure.RESOURCE_GONE));
    }

    /** Only an explicit ACL deny entry or policy deny overrides a valid link. */
    private Mono<ShareFailure> principalOverride(ShareDescriptor share, AccessAttempt attempt) {
        AccessCheck check = new AccessCheck(share.getResourceId(), share.getResourceType(), attempt.action().action(),
                attempt.principal(), null, Map.of("shareId", share.getId(), "sharedBy", share.getCreatedBy()));
        return evaluator.checkAccess(check)
                .filter(decision -> !decision.granted() && decision.reason().isExplicitDenial())
                .doOnNext(decision -> log.info("Share {} refused for {}: {} ({})", share.getId(), attempt.principal(),
                        decision.reason().code(), decision.detail()))
                .map(decision -> ShareFailure.UNAUTHORIZED);
    }

    private Mono<ShareAccessResult> recordFailure(ShareDescriptor share, AccessAttempt attempt, ShareFailure failure) {
        Instant now = clock.instant();
        appendLog(share, attempt, AccessOutcome.FAILURE, failure, now);
        if (failure == ShareFailure.EXPIRED) {
            share.terminate(ShareStatus.EXPIRED, now);
        } else if (failure == ShareFailure.ACCESS_EXHAUSTED) {
            share.terminate(ShareStatus.ACCESS_EXHAUSTED, now);
        }
        log.debug("Share {} access by {} failed: {}", share.getId(), attempt.principal(), failure.code());
        return save(share).thenReturn(ShareAccessResult.failed(share, failure));
    }

    private Mono<ShareAccessResult> recordSuccess(ShareDescriptor share, AccessAttempt attempt) {
        Instant now = clock.instant();
        appendLog(share, attempt, AccessOutcome.SUCCESS, null, now);
        share.setAccessCount(share.getAccessCount() + 1);
        share.setUpdatedAt(now);
        if (share.isLimitReached()) {
            share.terminate(ShareStatus.ACCESS_EXHAUSTED, now);
            log.info("Share {} reached its access limit of {}", share.getId(), share.getMaxAccessCount());
        }
        return save(share).thenReturn(ShareAccessResult.granted(share));
    }

    /** Timestamps within one log strictly increase, even if the clock does not. */
    private void appendLog(ShareDescriptor share, AccessAttempt attempt, AccessOutcome outcome,
                           ShareFailure reason, Instant now) {
        Instant timestamp = now;
        AccessLogEntry last = share.lastLogEntry();
        if (last != null && !timestamp.isAfter(last.timestamp())) {
            timestamp = last.timestamp().plusMillis(1);
        }
        share.getAccessLog().add(new AccessLogEntry(
                crypto.generateSecureId("access"),
                attempt.principal(),
                timestamp,
                attempt.action(),
                outcome,
                reason,
                attempt.sourceHint(),
                attempt.userAgent(),
                DeviceType.fromUserAgent(attempt.userAgent())));
    }

    /** Idempotent. The descriptor and its log are kept; a terminal status other than revoked is left as is. */
    public Mono<ShareDescriptor> revokeShare(String shareId, String revokedBy) {
        return share(shareId).flatMap(share -> {
            if (!share.isActive()) {
                log.debug("Share {} already inactive ({})", shareId, share.getStatus().code());
                return Mono.just(share);
            }
            share.terminate(ShareStatus.REVOKED, clock.instant());
            return save(share)
                    .then(auditTrail.record(revokedBy, AuditAction.SHARE_REVOKED, shareId,
                            details("resourceId", share.getResourceId())))
                    .thenReturn(share);
        });
    }

    /** Moves active shares that are past expiry or at their access limit to a terminal status. */
    public Mono<Long> cleanupExpiredShares() {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            return shares()
                    .filter(share -> share.getStatus() == ShareStatus.ACTIVE)
                    .filter(share -> share.isExpiredAt(now) || share.isLimitReached())
                    .concatMap(share -> {
                        share.terminate(share.isExpiredAt(now) ? ShareStatus.EXPIRED : ShareStatus.ACCESS_EXHAUSTED, now);
                        return save(share).thenReturn(share);
                    })
                    .count()
                    .doOnNext(count -> {
                        if (count > 0) {
                            log.info("Deactivated {} expired or exhausted shares", count);
                        }
                    });
        });
    }

    /**
     * Drops log entries older than {@code retention}; pruned successes move into
     * {@code archivedAccessCount}. Returns how many entries were dropped.
     */
    public Mono<Long> pruneAccessLogs(Duration retention) {
        return Mono.defer(() -> {
            Instant cutoff = clock.instant().minus(retention);
            return shares()
                    .concatMap(share -> {
                        List<AccessLogEntry> kept = new ArrayList<>();
                        int removed = 0;
                        int removedSuccesses = 0;
                        for (AccessLogEntry entry : share.getAccessLog()) {
                            if (entry.timestamp().isBefore(cutoff)) {
                                removed++;
                                if (entry.succeeded()) {
                                    removedSuccesses++;
                                }
                            } else {
                                kept.add(entry);
                            }
                        }
                        if (removed == 0) {
                            return Mono.just(0L);
                        }
                        share.setArchivedAccessCount(share.getArchivedAccessCount() + removedSuccesses);
                        share.setAccessLog(kept);
                        return save(share).thenReturn((long) removed);
                    })
                    .reduce(0L, Long::sum)
                    .doOnNext(count -> {
                        if (count > 0) {
                            log.info("Pruned {} access log entries older than {}", count, cutoff);
                        }
                    });
        });
    }

    /** Recomputes {@code accessCount} from the log and the archived total. */
    public Mono<ShareDescriptor> reconcileAccessCount(String shareId) {
        return share(shareId).flatMap(share -> {
            long logged = share.getAccessLog().stream().filter(AccessLogEntry::succeeded).count();
            int expected = share.getArchivedAccessCount() + (int) logged;
            if (expected == share.getAccessCount()) {
                return Mono.just(share);
            }
            log.warn("Share {} access count drifted: stored {}, log says {}", shareId, share.getAccessCount(), expected);
            share.setAccessCount(expected);
            return save(share).thenReturn(share);
        });
    }

    public Mono<ShareLink> regenerateToken(String shareId, String requestedBy) {
        return activeShare(shareId).flatMap(share -> {
            String previous = share.getToken();
            share.setToken(crypto.generateSecureToken(TOKEN_BYTES));
            share.setUpdatedAt(clock.instant());
            log.info("Share {} token regenerated by {}", shareId, requestedBy);
            return store.remove(TOKEN_INDEX + crypto.sha256Hex(previous))
                    .then(save(share))
                    .then(index(share))
                    .thenReturn(toLink(share));
        });
    }

    /** Pushes expiry back by {@code additionalHours}; the result may not exceed the maximum lifetime from now. */
    public Mono<ShareDescriptor> extendExpiration(String shareId, double additionalHours) {
        Duration extension = hours(additionalHours);
        return activeShare(shareId).flatMap(share -> {
            Instant now = clock.instant();
            Instant extended = share.getExpiresAt().plus(extension);
            if (extended.isAfter(now.plus(properties.maxExpiration()))) {
                return Mono.error(new IllegalArgumentException(
                        "Shares cannot expire more than " + properties.maxExpiration().toDays() + " days from now"));
            }
            share.setExpiresAt(extended);
            share.setUpdatedAt(now);
            return save(share).thenReturn(share);
        });
    }

    public Mono<ShareDescriptor> updatePermission(String shareId, SharePermission permission, String updatedBy) {
        if (permission == null) {
            throw new IllegalArgumentException("permission is required");
        }
        return activeShare(shareId).flatMap(share -> {
            log.info("Share {} permission {} -> {} by {}", shareId, share.getPermission().code(), permission.code(), updatedBy);
            share.setPermission(permission);
            share.setUpdatedAt(clock.instant());
            return save(share).thenReturn(share);
        });
    }

    public Mono<ShareDescriptor> share(String shareId) {
        return store.retrieve(SHARE + shareId, ShareDescriptor.class)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Share", shareId)));
    }

    public Flux<ShareDescriptor> sharesCreatedBy(String createdBy) {
        return shares().filter(share -> share.getCreatedBy().equals(createdBy));
    }

    /** Shares that can still be used right now. */
    public Flux<ShareDescriptor> activeShares() {
        return Flux.defer(() -> {
            Instant now = clock.instant();
            return shares().filter(share -> stateFailure(share, now).isEmpty());
        });
    }

    public Flux<AccessLogEntry> accessLog(String shareId) {
        return share(shareId).flatMapIterable(ShareDescriptor::getAccessLog);
    }

    /** Analytics over log entries with {@code from <= timestamp < to}; either bound may be null. */
    public Mono<ShareAnalytics> analytics(String shareId, Instant from, Instant to) {
        return share(shareId).map(share -> analyticsOf(share, from, to, clock.instant()));
    }

    /** The shares {@code createdBy} made, each with its all-time analytics, plus totals. */
    public Mono<ShareExport> exportShareData(String createdBy) {
        requireText(createdBy, "createdBy");
        return sharesCreatedBy(createdBy)
                .sort(Comparator.comparing(ShareDescriptor::getCreatedAt))
                .collectList()
                .map(shares -> {
                    Instant now = clock.instant();
                    return new ShareExport(
                            createdBy,
                            shares.stream().map(ShareSummary::of).toList(),
                            shares.stream().map(share -> analyticsOf(share, null, null, now)).toList(),
                            shares.size(),
                            (int) shares.stream().filter(share -> stateFailure(share, now).isEmpty()).count(),
                            now);
                });
    }

    private static ShareAnalytics analyticsOf(ShareDescriptor share, Instant from, Instant to, Instant now) {
        List<AccessLogEntry> window = share.getAccessLog().stream()
                .filter(entry -> from == null || !entry.timestamp().isBefore(from))
                .filter(entry -> to == null || entry.timestamp().isBefore(to))
                .toList();
        List<AccessLogEntry> successes = window.stream().filter(AccessLogEntry::succeeded).toList();

        return new ShareAnalytics(
                share.getId(),
                successes.size(),
                successes.stream().filter(entry -> entry.action() == ShareAction.VIEW).count(),
                successes.stream().filter(entry -> entry.action() == ShareAction.DOWNLOAD).count(),
                successes.stream().map(AccessLogEntry::principal).distinct().count(),
                window.size() - successes.size(),
                successes.stream().map(AccessLogEntry::timestamp).max(Instant::compareTo).orElse(null),
                countBy(successes, entry -> entry.timestamp().atOffset(ZoneOffset.UTC).toLocalDate().toString()),
                countBy(successes, entry -> entry.sourceHint() != null ? entry.sourceHint() : "unknown"),
                countBy(successes, entry -> entry.deviceType().code()),
                share.getArchivedAccessCount(),
                share.getStatus() == ShareStatus.EXPIRED || share.isExpiredAt(now),
                share.isLimitReached());
    }

    private Flux<ShareDescriptor> shares() {
        return store.listKeys()
                .filter(key -> key.startsWith(SHARE))
                .concatMap(key -> store.retrieve(key, ShareDescriptor.class));
    }

    private Mono<ShareDescriptor> findByToken(String token) {
        if (token == null || token.isBlank()) {
            return Mono.empty();
        }
        return store.retrieve(TOKEN_INDEX + crypto.sha256Hex(token), ShareTokenIndex.class)
                .flatMap(index -> store.retrieve(SHARE + index.shareId(), ShareDescriptor.class))
                .filter(share -> MessageDigest.isEqual(
                        token.getBytes(StandardCharsets.UTF_8),
                        share.getToken().getBytes(StandardCharsets.UTF_8)));
    }

    private Mono<ShareDescriptor> activeShare(String shareId) {
        return share(shareId).flatMap(share -> stateFailure(share, clock.instant())
                .<Mono<ShareDescriptor>>map(failure -> Mono.error(new InvalidStateException(
                        "Share not active", "Share " + shareId + " is " + failure.code())))
                .orElseGet(() -> Mono.just(share)));
    }

    private Mono<Void> save(ShareDescriptor share) {
        return store.store(SHARE + share.getId(), share);
    }

    private Mono<Void> index(ShareDescriptor share) {
        return store.store(TOKEN_INDEX + crypto.sha256Hex(share.getToken()), new ShareTokenIndex(share.getId()));
    }

    private Mono<PasswordHash> hash(String password) {
        if (password == null || password.isEmpty()) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> crypto.hashPassword(password))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Duration lifetime(Double expirationHours) {
        Duration lifetime = expirationHours == null ? properties.defaultExpiration() : hours(expirationHours);
        if (lifetime.compareTo(properties.maxExpiration()) > 0) {
            throw new IllegalArgumentException(
                    "Shares cannot live longer than " + properties.maxExpiration().toDays() + " days");
        }
        return lifetime;
    }

    private static Duration hours(double hours) {
        if (Double.isNaN(hours) || Double.isInfinite(hours) || hours <= 0) {
            throw new IllegalArgumentException("Expiration hours must be positive");
        }
        Duration duration = Duration.ofMillis(Math.round(hours * MILLIS_PER_HOUR));
        if (duration.isZero()) {
            throw new IllegalArgumentException("Expiration is shorter than a millisecond");
        }
        return duration;
    }

    private static Map<String, Long> countBy(List<AccessLogEntry> entries, Function<AccessLogEntry, String> key) {
        return entries.stream().collect(Collectors.groupingBy(key, TreeMap::new, Collectors.counting()));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
