package com.docvault.access;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/access")
public class AccessController {

    private final AccessEvaluator evaluator;
    private final AccessControlService accessControl;
    private final AccessRequestService accessRequests;

    public AccessController(AccessEvaluator evaluator,
                            AccessControlService accessControl,
                            AccessRequestService accessRequests) {
        this.evaluator = evaluator;
        this.accessControl = accessControl;
        this.accessRequests = accessRequests;
    }

    @PostMapping("/check")
    public Mono<AccessDecision> check(@RequestBody AccessCheck check) {
        return evaluator.checkAccess(check);
    }

    @PostMapping("/grants")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<PermissionGrant> grant(@Valid @RequestBody GrantRequest request) {
        return accessControl.grantPermission(request);
    }

    @DeleteMapping("/grants/{principalId}/{grantId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> revoke(@PathVariable String principalId,
                             @PathVariable String grantId,
                             @RequestParam String revokedBy) {
        return accessControl.revokePermission(principalId, grantId, revokedBy).then();
    }

    @PostMapping("/roles/{roleId}/assignments")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<RoleAssignment> assignRole(@PathVariable String roleId, @Valid @RequestBody AssignRoleRequest request) {
        return accessControl.assignRole(request.principalId(), roleId, request.resourceId(),
                request.grantedBy(), request.expiresAt());
    }

    @PostMapping("/acl/{resourceId}")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<AccessControlList> createAcl(@PathVariable String resourceId, @Valid @RequestBody CreateAclRequest request) {
        return accessControl.createAcl(resourceId, request.resourceType(), request.defaultEffect(), request.createdBy());
    }

    @PostMapping("/acl/{resourceId}/entries")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<AclEntry> addAclEntry(@PathVariable String resourceId, @Valid @RequestBody AclEntryRequest request) {
        return accessControl.addAclEntry(resourceId, request);
    }

    @PostMapping("/groups")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<FamilyGroup> createGroup(@Valid @RequestBody CreateGroupRequest request) {
        FamilyGroupSettings settings = new FamilyGroupSettings(request.autoApproveMembers(), true,
                request.maxMembers() != null ? request.maxMembers() : FamilyGroupSettings.DEFAULT_MAX_MEMBERS);
        return accessControl.createFamilyGroup(request.name(), request.description(), request.createdBy(), settings);
    }

    @GetMapping("/groups/{groupId}")
    public Mono<FamilyGroup> group(@PathVariable String groupId) {
        return accessControl.familyGroup(groupId);
    }

    @PostMapping("/groups/{groupId}/members")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<FamilyGroup> addMember(@PathVariable String groupId, @Valid @RequestBody AddMemberRequest request) {
        return accessControl.addGroupMember(groupId, request.userId(), request.relationship(),
                request.permissions(), request.invitedBy());
    }

    @PostMapping("/groups/{groupId}/members/{userId}/approve")
    public Mono<FamilyGroup> approveMember(@PathVariable String groupId, @PathVariable String userId,
                                           @Valid @RequestBody ReviewRequest review) {
        return accessControl.approveGroupMember(groupId, userId, review.reviewedBy());
    }

    @DeleteMapping("/groups/{groupId}/members/{userId}")
    public Mono<FamilyGroup> removeMember(@PathVariable String groupId, @PathVariable String userId,
                                          @RequestParam String removedBy) {
        return accessControl.removeGroupMember(groupId, userId, removedBy);
    }

    @GetMapping("/principals/{principalId}/permissions")
    public Mono<List<String>> permissions(@PathVariable String principalId) {
        return accessControl.effectivePermissions(principalId);
    }

    @GetMapping("/principals/{principalId}")
    public Mono<Principal> principal(@PathVariable String principalId) {
        return accessControl.describePrincipal(principalId);
    }

    @PostMapping("/requests")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<AccessRequestRecord> requestAccess(@Valid @RequestBody NewAccessRequest request) {
        return accessRequests.requestAccess(request.requestedBy(), request.resourceId(), request.resourceType(),
                request.actions(), request.reason());
    }

    @GetMapping("/requests")
    public Flux<AccessRequestRecord> pendingRequests(@RequestParam String resourceId) {
        return accessRequests.pendingRequestsFor(resourceId);
    }

    @PostMapping("/requests/{requestId}/approve")
    public Mono<List<PermissionGrant>> approve(@PathVariable String requestId, @Valid @RequestBody ReviewRequest review) {
        return accessRequests.approveAccessRequest(requestId, review.reviewedBy(), review.message());
    }

    @PostMapping("/requests/{requestId}/deny")
    public Mono<AccessRequestRecord> deny(@PathVariable String requestId, @Valid @RequestBody ReviewRequest review) {
        return accessRequests.denyAccessRequest(requestId, review.reviewedBy(), review.message());
    }

    public record AssignRoleRequest(@NotBlank(message = "principalId is required") String principalId, String resourceId, String grantedBy, Instant expiresAt) {}

    public record CreateAclRequest(@NotBlank(message = "resourceType is required") String resourceType, Effect defaultEffect, String createdBy) {}

    public record CreateGroupRequest(@NotBlank(message = "name is required") String name, String description,
                                     @NotBlank(message = "createdBy is required") String createdBy,
                                     boolean autoApproveMembers, Integer maxMembers) {}

    public record AddMemberRequest(@NotBlank(message = "userId is required") String userId, String relationship,
                                   List<String> permissions, String invitedBy) {}

    public record NewAccessRequest(@NotBlank(message = "requestedBy is required") String requestedBy,
                                   @NotBlank(message = "resourceId is required") String resourceId,
                                   @NotBlank(message = "resourceType is required") String resourceType,
                                   List<Action> actions, String reason) {}

    public record ReviewRequest(@NotBlank(message = "reviewedBy is required") String reviewedBy, String message) {}
}
