package com.docvault.access;

import com.docvault.audit.AuditAction;
import com.docvault.audit.AuditTrail;
import com.docvault.crypto.CryptoService;
import com.docvault.exception.InvalidStateException;
import com.docvault.exception.ResourceNotFoundException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static com.docvault.audit.AuditTrail.details;

/**
 * Access requests: a principal asks for actions on a resource, an owner approves (turning the
 * request into grants) or denies it. Pending requests lapse after seven days.
 */
@Service
public class AccessRequestService {

    static final Duration PENDING_LIFETIME = Duration.ofDays(7);

    private final AccessStore accessStore;
    private final AccessControlService accessControl;
    private final AuditTrail auditTrail;
    private final CryptoService crypto;
    private final Clock clock;

    public AccessRequestService(AccessStore accessStore, AccessControlService accessControl,
                                AuditTrail auditTrail, CryptoService crypto, Clock clock) {
        this.accessStore = accessStore;
        this.accessControl = accessControl;
        this.auditTrail = auditTrail;
        this.crypto = crypto;
        this.clock = clock;
    }

    public Mono<AccessRequestRecord> requestAccess(String requestedBy, String resourceId, String resourceType,
                                                   List<Action> actions, String reason) {
        if (actions == null || actions.isEmpty() || actions.contains(Action.ANY)) {
            throw new IllegalArgumentException("At least one concrete action must be requested");
        }
        return Mono.defer(() -> {
            Instant now = clock.instant();
            AccessRequestRecord request = new AccessRequestRecord(crypto.generateSecureId("request"),
                    requestedBy, resourceId, resourceType, actions, reason, AccessRequestStatus.PENDING,
                    null, null, null, now, now.plus(PENDING_LIFETIME));
            return accessStore.saveAccessRequest(request)
                    .then(auditTrail.record(requestedBy, AuditAction.ACCESS_REQUESTED, resourceId,
                            details("requestId", request.id(), "actions", codes(actions))))
                    .thenReturn(request);
        });
    }

    /**
     * Approves a pending request and grants each requested action on the resource. The grants
     * expire when the request would have.
     */
    public Mono<List<PermissionGrant>> approveAccessRequest(String requestId, String approvedBy, String responseMessage) {
        return pending(requestId).flatMap(request -> {
            AccessRequestRecord approved = request.reviewed(AccessRequestStatus.APPROVED, approvedBy,
                    clock.instant(), responseMessage);
            return Flux.fromIterable(request.actions())
                    .concatMap(action -> accessControl.grantPermission(new GrantRequest(request.requestedBy(),
                            request.resourceType(), request.resourceId(), action, approvedBy,
                            request.expiresAt(), List.of())))
                    .collectList()
                    .flatMap(grants -> accessStore.saveAccessRequest(approved)
                            .then(auditTrail.record(approvedBy, AuditAction.ACCESS_REQUEST_APPROVED, request.resourceId(),
                                    details("requestId", requestId, "grantedTo", request.requestedBy(),
                                            "actions", codes(request.actions()))))
                            .thenReturn(grants));
        });
    }

    public Mono<AccessRequestRecord> denyAccessRequest(String requestId, String deniedBy, String responseMessage) {
        return pending(requestId).flatMap(request -> {
            AccessRequestRecord denied = request.reviewed(AccessRequestStatus.DENIED, deniedBy,
                    clock.instant(), responseMessage);
            return accessStore.saveAccessRequest(denied)
                    .then(auditTrail.record(deniedBy, AuditAction.ACCESS_REQUEST_DENIED, request.resourceId(),
                            details("requestId", requestId, "requestedBy", request.requestedBy())))
                    .thenReturn(denied);
        });
    }

    public Flux<AccessRequestRecord> pendingRequestsFor(String resourceId) {
        return accessStore.accessRequests()
                .filter(request -> request.status() == AccessRequestStatus.PENDING)
                .filter(request -> request.resourceId().equals(resourceId));
    }

    private Mono<AccessRequestRecord> pending(String requestId) {
        return accessStore.accessRequest(requestId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Access request", requestId)))
                .flatMap(request -> request.status() == AccessRequestStatus.PENDING
                        ? Mono.just(request)
                        : Mono.error(new InvalidStateException("Access request already reviewed",
                                "Request " + requestId + " is " + request.status().code())));
    }

    private static String codes(List<Action> actions) {
        return actions.stream().map(Action::code).collect(Collectors.joining(","));
    }
}
