package com.docvault.access;

import com.docvault.audit.AuditAction;
import com.docvault.audit.AuditTrail;
import com.docvault.crypto.CryptoService;
import com.docvault.exception.InvalidStateException;
import com.docvault.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static com.docvault.audit.AuditTrail.details;

/**
 * Mutations of grants, roles, role assignments, family groups, ACLs and policies. Every mutation is
 * written through the encrypted store and then appended to the {@link AuditTrail}.
 */
@Service
public class AccessControlService {

    private static final Logger log = LoggerFactory.getLogger(AccessControlService.class);

    public static final String ADMIN_ROLE = "admin";
    public static final String USER_ROLE = "user";
    public static final String FAMILY_MEMBER_ROLE = "family_member";
    public static final String GUEST_ROLE = "guest";

    private final AccessStore accessStore;
    private final AuditTrail auditTrail;
    private final CryptoService crypto;
    private final Clock clock;

    public AccessControlService(AccessStore accessStore, AuditTrail auditTrail, CryptoService crypto, Clock clock) {
        this.accessStore = accessStore;
        this.auditTrail = auditTrail;
        this.crypto = crypto;
        this.clock = clock;
    }

    public Mono<PermissionGrant> grantPermission(GrantRequest request) {
        requireText(request.principalId(), "principalId");
        requireText(request.resourceType(), "resourceType");
        if (request.action() == null) {
            throw new IllegalArgumentException("action is required");
        }
        return Mono.defer(() -> {
            Instant now = clock.instant();
            PermissionGrant grant = new PermissionGrant(
                    crypto.generateSecureId("grant"),
                    request.principalId(),
                    request.resourceType(),
                    request.resourceId(),
                    request.action(),
                    request.grantedBy(),
                    now,
                    request.expiresAt(),
                    request.conditions());
            return accessStore.grants(request.principalId())
                    .flatMap(grants -> accessStore.saveGrants(grants.with(grant)))
                    .then(auditTrail.record(request.grantedBy(), AuditAction.PERMISSION_GRANTED, request.principalId(),
                            details("grantId", grant.id(),
                                    "permission", grant.permissionId(),
                                    "resourceId", grant.resourceId(),
                                    "expiresAt", grant.expiresAt() != null ? grant.expiresAt().toString() : null)))
                    .thenReturn(grant);
        });
    }

    /** Removes a grant. Revoking an unknown grant is a no-op apart from the audit entry. */
    public Mono<Boolean> revokePermission(String principalId, String grantId, String revokedBy) {
        return accessStore.grants(principalId)
                .flatMap(grants -> {
                    boolean present = grants.grants().stream().anyMatch(grant -> grant.id().equals(grantId));
                    Mono<Void> write = present ? accessStore.saveGrants(grants.without(grantId)) : Mono.empty();
                    return write
                            .then(auditTrail.record(revokedBy, AuditAction.PERMISSION_REVOKED, principalId,
                                    details("grantId", grantId, "found", Boolean.toString(present))))
                            .thenReturn(present);
                });
    }

    public Mono<Role> defineRole(Role role, String definedBy) {
        requireText(role.id(), "role id");
        return accessStore.saveRole(role)
                .then(auditTrail.record(definedBy, AuditAction.ROLE_DEFINED, role.id(),
                        details("hierarchyLevel", Integer.toString(role.hierarchyLevel()),
                                "permissions", Integer.toString(role.permissions().size()))))
                .thenReturn(role);
    }

    public Flux<Role> roles() {
        return accessStore.roles();
    }

    public Mono<RoleAssignment> assignRole(String principalId, String roleId, String resourceId,
                                           String grantedBy, Instant expiresAt) {
        requireText(principalId, "principalId");
        return accessStore.role(roleId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Role", roleId)))
                .flatMap(role -> {
                    RoleAssignment assignment = new RoleAssignment(
                            crypto.generateSecureId("assignment"),
                            principalId, roleId, resourceId, grantedBy, clock.instant(), expiresAt, true);
                    return accessStore.roleAssignments(principalId)
                            .flatMap(current -> accessStore.saveRoleAssignments(current.with(assignment)))
                            .then(auditTrail.record(grantedBy, AuditAction.ROLE_ASSIGNED, principalId,
                                    details("roleId", roleId, "assignmentId", assignment.id(), "resourceId", resourceId)))
                            .thenReturn(assignment);
                });
    }

    public Mono<Boolean> unassignRole(String principalId, String assignmentId, String removedBy) {
        return accessStore.roleAssignments(principalId)
                .flatMap(current -> {
                    boolean present = current.assignments().stream().anyMatch(a -> a.id().equals(assignmentId));
                    Mono<Void> write = present ? accessStore.saveRoleAssignments(current.without(assignmentId)) : Mono.empty();
                    return write
                            .then(auditTrail.record(removedBy, AuditAction.ROLE_UNASSIGNED, principalId,
                                    details("assignmentId", assignmentId, "found", Boolean.toString(present))))
                            .thenReturn(present);
                });
    }

    /**
     * Defines the built-in roles that are not yet present: admin (100, everything), user (10,
     * own profile and sharing documents), family_member (5, family reads) and guest (1, nothing).
     */
    public Flux<Role> seedDefaultRoles() {
        return Flux.fromIterable(defaultRoles())
                .concatMap(role -> accessStore.role(role.id())
                        .hasElement()
                        .flatMap(exists -> exists ? Mono.<Role>empty() : defineRole(role, "system")))
                .doOnNext(role -> log.info("Seeded default role {}", role.id()));
    }

    static List<Role> defaultRoles() {
        return List.of(
                new Role(ADMIN_ROLE, "Administrator", "Full access to every resource", 100,
                        List.of(new Permission("admin_all", "All actions", Permission.ANY_RESOURCE, Action.ANY, List.of())),
                        true),
                new Role(USER_ROLE, "User", "Manages their own profile and shares documents", 10,
                        List.of(Permission.of("read_profile", "profile", Action.READ),
                                Permission.of("update_profile", "profile", Action.UPDATE),
                                Permission.of("share_document", "document", Action.SHARE)),
                        true),
                new Role(FAMILY_MEMBER_ROLE, "Family member", "Reads family resources", 5,
                        List.of(Permission.of("read_family", "family", Action.READ)),
                        true),
                new Role(GUEST_ROLE, "Guest", "No standing permissions", 1, List.of(), true));
    }

    /** Creates a family group with its creator as the first, active, admin member. */
    public Mono<FamilyGroup> createFamilyGroup(String name, String description, String createdBy,
                                               FamilyGroupSettings settings) {
        requireText(name, "name");
        requireText(createdBy, "createdBy");
        return Mono.defer(() -> {
            Instant now = clock.instant();
            FamilyMember creator = new FamilyMember(crypto.generateSecureId("member"), createdBy,
                    FamilyGroup.CREATOR_RELATIONSHIP, List.of(ADMIN_ROLE), now, createdBy, FamilyMemberStatus.ACTIVE);
            FamilyGroup group = new FamilyGroup(crypto.generateSecureId("family"), name, description, createdBy,
                    List.of(creator), settings, now, now);
            return accessStore.saveFamilyGroup(group)
                    .then(indexMembership(group.id(), createdBy))
                    .then(auditTrail.record(createdBy, AuditAction.FAMILY_GROUP_CREATED, group.id(),
                            details("name", name, "maxMembers", Integer.toString(group.settings().maxMembers()))))
                    .thenReturn(group);
        });
    }

    public Mono<FamilyGroup> familyGroup(String groupId) {
        return accessStore.familyGroup(groupId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Family group", groupId)));
    }

    /**
     * Adds a member, {@code pending} unless the group auto-approves. Fails with
     * {@link InvalidStateException} when the group is full or the user already belongs to it.
     */
    public Mono<FamilyGroup> addGroupMember(String groupId, String userId, String relationship,
                                            List<String> permissions, String invitedBy) {
        requireText(userId, "userId");
        return familyGroup(groupId).flatMap(group -> {
            if (group.member(userId).isPresent()) {
                return Mono.error(new InvalidStateException("Already a member",
                        "User " + userId + " already belongs to family group " + groupId));
            }
            if (group.isFull()) {
                return Mono.error(new InvalidStateException("Family group is full",
                        "Family group " + groupId + " has reached its capacity of " + group.settings().maxMembers()));
            }
            Instant now = clock.instant();
            FamilyMember member = new FamilyMember(crypto.generateSecureId("member"), userId, relationship,
                    permissions != null && !permissions.isEmpty() ? permissions : List.of("view"), now, invitedBy,
                    group.settings().autoApproveMembers() ? FamilyMemberStatus.ACTIVE : FamilyMemberStatus.PENDING);
            FamilyGroup updated = group.withMember(member, now);
            return accessStore.saveFamilyGroup(updated)
                    .then(indexMembership(groupId, userId))
                    .then(auditTrail.record(invitedBy, AuditAction.GROUP_MEMBER_ADDED, groupId,
                            details("userId", userId, "status", member.status().code())))
                    .thenReturn(updated);
        });
    }

    public Mono<FamilyGroup> approveGroupMember(String groupId, String userId, String approvedBy) {
        return familyGroup(groupId).flatMap(group -> {
            FamilyMember member = group.member(userId)
                    .orElseThrow(() -> new ResourceNotFoundException("Family member", userId));
            if (member.isActive()) {
                return Mono.just(group);
            }
            FamilyGroup updated = group.withActivatedMember(userId, clock.instant());
            return accessStore.saveFamilyGroup(updated)
                    .then(auditTrail.record(approvedBy, AuditAction.GROUP_MEMBER_APPROVED, groupId,
                            details("userId", userId)))
                    .thenReturn(updated);
        });
    }

    public Mono<FamilyGroup> removeGroupMember(String groupId, String userId, String removedBy) {
        return familyGroup(groupId).flatMap(group -> {
            if (group.member(userId).isEmpty()) {
                return Mono.error(new ResourceNotFoundException("Family member", userId));
            }
            FamilyGroup updated = group.withoutMember(userId, clock.instant());
            return accessStore.saveFamilyGroup(updated)
                    .then(accessStore.groups(userId)
                            .flatMap(memberships -> accessStore.saveGroups(memberships.without(groupId))))
                    .then(auditTrail.record(removedBy, AuditAction.GROUP_MEMBER_REMOVED, groupId,
                            details("userId", userId)))
                    .thenReturn(updated);
        });
    }

    private Mono<Void> indexMembership(String groupId, String userId) {
        return accessStore.groups(userId)
                .flatMap(memberships -> accessStore.saveGroups(memberships.with(groupId)));
    }

    public Mono<AccessControlList> createAcl(String resourceId, String resourceType, Effect defaultEffect,
                                             String createdBy) {
        requireText(resourceId, "resourceId");
        requireText(resourceType, "resourceType");
        return accessStore.acl(resourceId)
                .flatMap(existing -> Mono.<AccessControlList>error(new InvalidStateException(
                        "ACL already exists", "Resource " + resourceId + " already has an ACL")))
                .switchIfEmpty(Mono.defer(() -> {
                    Instant now = clock.instant();
                    AccessControlList acl = new AccessControlList(crypto.generateSecureId("acl"), resourceId,
                            resourceType, List.of(), defaultEffect != null ? defaultEffect : Effect.DENY, now, now);
                    return accessStore.saveAcl(acl)
                            .then(auditTrail.record(createdBy, AuditAction.ACL_CREATED, resourceId,
                                    details("aclId", acl.id(), "defaultEffect", acl.defaultEffect().code())))
                            .thenReturn(acl);
                }));
    }

    public Mono<AccessControlList> acl(String resourceId) {
        return accessStore.acl(resourceId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("ACL", resourceId)));
    }

    /** Appends an entry; entries are evaluated in the order they were added. */
    public Mono<AclEntry> addAclEntry(String resourceId, AclEntryRequest request) {
        requireText(request.principalId(), "principalId");
        if (request.principalType() == null || request.effect() == null
                || request.actions() == null || request.actions().isEmpty()) {
            throw new IllegalArgumentException("principalType, effect and at least one action are required");
        }
        return acl(resourceId).flatMap(acl -> {
            Instant now = clock.instant();
            AclEntry entry = new AclEntry(crypto.generateSecureId("acl_entry"), request.principalId(),
                    request.principalType(), request.effect(), request.actions(), request.grantedBy(),
                    now, request.expiresAt());
            return accessStore.saveAcl(acl.withEntry(entry, now))
                    .then(auditTrail.record(request.grantedBy(), AuditAction.ACL_ENTRY_ADDED, resourceId,
                            details("entryId", entry.id(),
                                    "principal", entry.principalType().code() + ":" + entry.principalId(),
                                    "effect", entry.effect().code())))
                    .thenReturn(entry);
        });
    }

    public Mono<Boolean> removeAclEntry(String resourceId, String entryId, String removedBy) {
        return acl(resourceId).flatMap(acl -> {
            boolean present = acl.entries().stream().anyMatch(entry -> entry.id().equals(entryId));
            Mono<Void> write = present ? accessStore.saveAcl(acl.withoutEntry(entryId, clock.instant())) : Mono.empty();
            return write
                    .then(auditTrail.record(removedBy, AuditAction.ACL_ENTRY_REMOVED, resourceId,
                            details("entryId", entryId, "found", Boolean.toString(present))))
                    .thenReturn(present);
        });
    }

    /** Adds a policy after the existing ones, or replaces the policy with the same id in place. */
    public Mono<AccessPolicy> definePolicy(AccessPolicy policy, String definedBy) {
        requireText(policy.id(), "policy id");
        AccessPolicy stamped = policy.createdAt() != null ? policy
                : new AccessPolicy(policy.id(), policy.name(), policy.description(), policy.active(),
                        policy.rules(), clock.instant());
        return accessStore.policies()
                .flatMap(policies -> accessStore.savePolicies(policies.with(stamped)))
                .then(auditTrail.record(definedBy, AuditAction.POLICY_DEFINED, stamped.id(),
                        details("rules", Integer.toString(stamped.rules().size()),
                                "active", Boolean.toString(stamped.active()))))
                .thenReturn(stamped);
    }

    public Mono<AccessPolicy> deactivatePolicy(String policyId, String deactivatedBy) {
        return accessStore.policies()
                .flatMap(policies -> Mono.justOrEmpty(policies.policies().stream()
                                .filter(policy -> policy.id().equals(policyId))
                                .findFirst())
                        .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Policy", policyId)))
                        .flatMap(policy -> {
                            AccessPolicy inactive = policy.deactivated();
                            return accessStore.savePolicies(policies.with(inactive))
                                    .then(auditTrail.record(deactivatedBy, AuditAction.POLICY_DEACTIVATED, policyId, Map.of()))
                                    .thenReturn(inactive);
                        }));
    }

    public Flux<AccessPolicy> policies() {
        return accessStore.policies().flatMapIterable(PolicySet::policies);
    }

    /**
     * Permission ids held by the principal: its unexpired direct grants ({@code read_document},
     * {@code admin_all}, ...) plus the permissions of its active global role assignments, sorted.
     */
    public Mono<List<String>> effectivePermissions(String principalId) {
        Instant now = clock.instant();
        Mono<List<String>> fromGrants = accessStore.grants(principalId)
                .map(grants -> grants.grants().stream()
                        .filter(grant -> !grant.isExpired(now))
                        .map(PermissionGrant::permissionId)
                        .toList());
        Mono<List<String>> fromRoles = accessStore.roleAssignments(principalId)
                .flatMapMany(assignments -> Flux.fromIterable(assignments.assignments()))
                .filter(assignment -> assignment.appliesTo(null, now))
                .concatMap(assignment -> accessStore.role(assignment.roleId()))
                .flatMapIterable(Role::permissions)
                .map(Permission::id)
                .collectList();
        return Mono.zip(fromGrants, fromRoles, (grants, roles) -> {
            TreeSet<String> ids = new TreeSet<>(grants);
            ids.addAll(roles);
            return List.copyOf(ids);
        });
    }

    public Mono<Principal> describePrincipal(String principalId) {
        return Mono.zip(accessStore.roleAssignments(principalId), accessStore.grants(principalId),
                        accessStore.activeGroupIds(principalId))
                .map(t -> new Principal(principalId, t.getT1().assignments(), t.getT2().grants(), t.getT3()));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
