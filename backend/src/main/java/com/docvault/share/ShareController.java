package com.docvault.share;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Share link endpoints. Denials come back as 200 responses carrying a reason code so clients can
 * prompt for a password or explain an expiry; only malformed requests and unknown share ids
 * produce error statuses.
 */
@RestController
@RequestMapping("/api/shares")
public class ShareController {

    private final ShareService shareService;
    private final ResourceRegistry resources;

    public ShareController(ShareService shareService, ResourceRegistry resources) {
        this.shareService = shareService;
        this.resources = resources;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ShareLink> create(@Valid @RequestBody CreateShareRequest request) {
        return shareService.createShareLink(request.resourceId(), new ShareConfig(
                request.createdBy(),
                request.resourceType(),
                request.password(),
                request.expirationHours(),
                request.maxAccessCount(),
                request.permission(),
                request.blockBots()));
    }

    @PostMapping("/validate")
    public Mono<ValidationResponse> validate(@Valid @RequestBody ValidateRequest request) {
        return shareService.validateShare(request.token(), request.password())
                .map(validation -> new ValidationResponse(validation.valid(),
                        validation.reason() != null ? validation.reason().code() : null,
                        validation.valid() ? ShareSummary.of(validation.share()) : null));
    }

    @PostMapping("/access")
    public Mono<AccessResponse> access(@Valid @RequestBody AccessShareRequest request,
                                       @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent) {
        AccessAttempt attempt = new AccessAttempt(request.principal(), request.password(), request.action(),
                request.sourceHint(), userAgent);
        return shareService.accessShare(request.token(), attempt)
                .map(result -> new AccessResponse(result.success(),
                        result.reason() != null ? result.reason().code() : null,
                        result.success() ? ShareSummary.of(result.share()) : null));
    }

    @DeleteMapping("/{shareId}")
    public Mono<ShareSummary> revoke(@PathVariable String shareId, @RequestParam String revokedBy) {
        return shareService.revokeShare(shareId, revokedBy).map(ShareSummary::of);
    }

    @GetMapping("/{shareId}/analytics")
    public Mono<ShareAnalytics> analytics(
            @PathVariable String shareId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return shareService.analytics(shareId, from, to);
    }

    @GetMapping
    public Flux<ShareSummary> sharesCreatedBy(@RequestParam String createdBy) {
        return shareService.sharesCreatedBy(createdBy).map(ShareSummary::of);
    }

    @GetMapping("/export")
    public Mono<ShareExport> export(@RequestParam String createdBy) {
        return shareService.exportShareData(createdBy);
    }

    @PostMapping("/{shareId}/extend")
    public Mono<ShareSummary> extend(@PathVariable String shareId, @RequestBody ExtendRequest request) {
        return shareService.extendExpiration(shareId, request.additionalHours()).map(ShareSummary::of);
    }

    @PutMapping("/{shareId}/permission")
    public Mono<ShareSummary> updatePermission(@PathVariable String shareId, @Valid @RequestBody PermissionRequest request) {
        return shareService.updatePermission(shareId, request.permission(), request.updatedBy()).map(ShareSummary::of);
    }

    @PostMapping("/{shareId}/token")
    public Mono<ShareLink> regenerateToken(@PathVariable String shareId, @RequestParam String requestedBy) {
        return shareService.regenerateToken(shareId, requestedBy);
    }

    /** Called by the document owner when a shared resource is deleted. */
    @DeleteMapping("/resources/{resourceId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> resourceDeleted(@PathVariable String resourceId, @RequestParam String deletedBy) {
        return resources.markDeleted(resourceId, deletedBy);
    }

    public record CreateShareRequest(@NotBlank(message = "resourceId is required") String resourceId,
                                     @NotBlank(message = "createdBy is required") String createdBy,
                                     String resourceType, String password,
                                     Double expirationHours, Integer maxAccessCount, SharePermission permission,
                                     Boolean blockBots) {}

    public record ValidateRequest(@NotBlank(message = "token is required") String token, String password) {}

    public record ValidationResponse(boolean valid, String reason, ShareSummary share) {}

    public record AccessShareRequest(@NotBlank(message = "token is required") String token, String principal, String password, ShareAction action,
                                     String sourceHint) {}

    public record AccessResponse(boolean success, String reason, ShareSummary share) {}

    public record ExtendRequest(double additionalHours) {}

    public record PermissionRequest(@NotNull(message = "permission is required") SharePermission permission,
                                    String updatedBy) {}
}
