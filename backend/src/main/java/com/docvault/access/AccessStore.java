package com.docvault.access;

import com.docvault.store.EncryptedStore;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Typed access to the access-control records kept in the {@link EncryptedStore}. One store
 * key per principal for grants, role assignments and group memberships, one per role, family
 * group, ACL and access request, and a single key for the ordered policy set.
 */
@Component
public class AccessStore {

    static final String GRANTS = "grants:";
    static final String ROLE = "role:";
    static final String ROLE_ASSIGNMENTS = "role-assignments:";
    static final String GROUPS = "groups:";
    static final String FAMILY_GROUP = "family-group:";
    static final String ACL = "acl:";
    static final String POLICIES = "policies";
    static final String ACCESS_REQUEST = "access-request:";

    private final EncryptedStore store;

    public AccessStore(EncryptedStore store) {
        this.store = store;
    }

    public Mono<PrincipalGrants> grants(String principalId) {
        return store.retrieve(GRANTS + principalId, PrincipalGrants.class)
                .defaultIfEmpty(PrincipalGrants.empty(principalId));
    }

    public Mono<Void> saveGrants(PrincipalGrants grants) {
        return store.store(GRANTS + grants.principalId(), grants);
    }

    public Mono<Role> role(String roleId) {
        return store.retrieve(ROLE + roleId, Role.class);
    }

    public Mono<Void> saveRole(Role role) {
        return store.store(ROLE + role.id(), role);
    }

    public Flux<Role> roles() {
        return store.listKeys()
                .filter(key -> key.startsWith(ROLE))
                .concatMap(key -> store.retrieve(key, Role.class));
    }

    public Mono<RoleAssignments> roleAssignments(String principalId) {
        return store.retrieve(ROLE_ASSIGNMENTS + principalId, RoleAssignments.class)
                .defaultIfEmpty(RoleAssignments.empty(principalId));
    }

    public Mono<Void> saveRoleAssignments(RoleAssignments assignments) {
        return store.store(ROLE_ASSIGNMENTS + assignments.principalId(), assignments);
    }

    public Mono<GroupMemberships> groups(String principalId) {
        return store.retrieve(GROUPS + principalId, GroupMemberships.class)
                .defaultIfEmpty(GroupMemberships.empty(principalId));
    }

    public Mono<Void> saveGroups(GroupMemberships memberships) {
        return store.store(GROUPS + memberships.principalId(), memberships);
    }

    public Mono<FamilyGroup> familyGroup(String groupId) {
        return store.retrieve(FAMILY_GROUP + groupId, FamilyGroup.class);
    }

    public Mono<Void> saveFamilyGroup(FamilyGroup group) {
        return store.store(FAMILY_GROUP + group.id(), group);
    }

    /** Ids of the groups the principal is an active member of, in join order. */
    public Mono<List<String>> activeGroupIds(String principalId) {
        return groups(principalId)
                .flatMapMany(memberships -> Flux.fromIterable(memberships.groupIds()))
                .concatMap(groupId -> familyGroup(groupId)
                        .filter(group -> group.hasActiveMember(principalId))
                        .map(FamilyGroup::id))
                .collectList();
    }

    public Mono<AccessControlList> acl(String resourceId) {
        return store.retrieve(ACL + resourceId, AccessControlList.class);
    }

    public Mono<Void> saveAcl(AccessControlList acl) {
        return store.store(ACL + acl.resourceId(), acl);
    }

    public Mono<PolicySet> policies() {
        return store.retrieve(POLICIES, PolicySet.class)
                .defaultIfEmpty(PolicySet.empty());
    }

    public Mono<Void> savePolicies(PolicySet policies) {
        return store.store(POLICIES, policies);
    }

    public Mono<AccessRequestRecord> accessRequest(String requestId) {
        return store.retrieve(ACCESS_REQUEST + requestId, AccessRequestRecord.class);
    }

    public Flux<AccessRequestRecord> accessRequests() {
        return store.listKeys()
                .filter(key -> key.startsWith(ACCESS_REQUEST))
                .concatMap(key -> store.retrieve(key, AccessRequestRecord.class));
    }

    /** Pending requests lapse with the store entry; reviewed ones are kept without expiry. */
    public Mono<Void> saveAccessRequest(AccessRequestRecord request) {
        Instant expiresAt = request.status() == AccessRequestStatus.PENDING ? request.expiresAt() : null;
        return store.store(ACCESS_REQUEST + request.id(), request, expiresAt);
    }
}
