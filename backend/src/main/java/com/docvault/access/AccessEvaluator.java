package com.docvault.access;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a principal may perform an action on a resource. Tiers are tried in a fixed
 * order and the first one that decides wins:
 *
 * <ol>
 *   <li>explicit grants held by the principal (including admin-all),</li>
 *   <li>permissions of the roles the principal acts in or is assigned,</li>
 *   <li>the resource's ACL: principal entries, then role entries, then entries for the family
 *   groups the principal is an active member of,</li>
 *   <li>active policies, first matching rule.</li>
 * </ol>
 *
 * <p>An ACL whose default is {@code deny} does not stop evaluation: a matching policy rule can
 * still decide, and only when none does is the request denied with {@code acl_default_deny}.
 * Evaluations are read-only and not audited.
 */
@Service
public class AccessEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AccessEvaluator.class);

    private final AccessStore accessStore;
    private final Clock clock;

    public AccessEvaluator(AccessStore accessStore, Clock clock) {
        this.accessStore = accessStore;
        this.clock = clock;
    }

    public Mono<AccessDecision> checkAccess(AccessCheck check) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            return explicitGrant(check, now)
                    .switchIfEmpty(Mono.defer(() -> roleIds(check, now)
                            .flatMap(roleIds -> rolePermission(check, roleIds)
                                    .switchIfEmpty(Mono.defer(() -> aclThenPolicy(check, roleIds, now))))))
                    .defaultIfEmpty(AccessDecision.noMatch())
                    .doOnNext(decision -> log.debug("Access {} for {} {} on {}/{}: {} ({})",
                            decision.granted() ? "granted" : "denied", check.principalId(),
                            check.action().code(), check.resourceType(), check.resourceId(),
                            decision.reason().code(), decision.policy().code()));
        });
    }

    private Mono<AccessDecision> explicitGrant(AccessCheck check, Instant now) {
        return accessStore.grants(check.principalId())
                .flatMap(grants -> Mono.justOrEmpty(grants.grants().stream()
                        .filter(grant -> grant.matches(check, now))
                        .findFirst()))
                .map(grant -> AccessDecision.allow(AccessReason.EXPLICIT_GRANT, DecisionTier.EXPLICIT, grant.id()));
    }

    /** The role the caller acts in first, then active stored assignments in order. */
    private Mono<List<String>> roleIds(AccessCheck check, Instant now) {
        return accessStore.roleAssignments(check.principalId())
                .map(assignments -> {
                    List<String> ids = new ArrayList<>();
                    if (check.principalRole() != null && !check.principalRole().isBlank()) {
                        ids.add(check.principalRole());
                    }
                    assignments.assignments().stream()
                            .filter(assignment -> assignment.appliesTo(check.resourceId(), now))
                            .map(RoleAssignment::roleId)
                            .filter(id -> !ids.contains(id))
                            .forEach(ids::add);
                    return ids;
                });
    }

    private Mono<AccessDecision> rolePermission(AccessCheck check, List<String> roleIds) {
        return Flux.fromIterable(roleIds)
                .concatMap(accessStore::role)
                .concatMap(role -> Mono.justOrEmpty(role.permissions().stream()
                        .filter(permission -> permission.matches(check.resourceType(), check.action(), check.context()))
                        .findFirst()
                        .map(permission -> AccessDecision.allow(AccessReason.ROLE_PERMISSION, DecisionTier.ROLE,
                                role.id() + ":" + permission.id()))))
                .next();
    }

    private Mono<AccessDecision> aclThenPolicy(AccessCheck check, List<String> roleIds, Instant now) {
        return aclDecision(check, roleIds, now)
                .flatMap(decision -> decision.reason() == AccessReason.ACL_DEFAULT_DENY
                        ? policyDecision(check).defaultIfEmpty(decision)
                        : Mono.just(decision))
                .switchIfEmpty(Mono.defer(() -> policyDecision(check)));
    }

    private Mono<AccessDecision> aclDecision(AccessCheck check, List<String> roleIds, Instant now) {
        if (check.resourceId() == null) {
            return Mono.empty();
        }
        return accessStore.acl(check.resourceId())
                .filter(acl -> acl.resourceType() == null || acl.resourceType().equals(check.resourceType()))
                .flatMap(acl -> accessStore.activeGroupIds(check.principalId())
                        .map(groupIds -> {
                            Optional<AclEntry> entry = acl.firstMatch(PrincipalType.USER, List.of(check.principalId()), check.action(), now)
                                    .or(() -> acl.firstMatch(PrincipalType.ROLE, roleIds, check.action(), now))
                                    .or(() -> acl.firstMatch(PrincipalType.GROUP, groupIds, check.action(), now));
                            return entry
                                    .map(AccessEvaluator::fromEntry)
                                    .orElseGet(() -> fromDefault(acl));
                        }));
    }

    private static AccessDecision fromEntry(AclEntry entry) {
        return entry.effect() == Effect.ALLOW
                ? AccessDecision.allow(AccessReason.ACL_ENTRY_ALLOW, DecisionTier.ACL, entry.id())
                : AccessDecision.deny(AccessReason.ACL_ENTRY_DENY, DecisionTier.ACL, entry.id());
    }

    private static AccessDecision fromDefault(AccessControlList acl) {
        return acl.defaultEffect() == Effect.ALLOW
                ? AccessDecision.allow(AccessReason.ACL_DEFAULT_ALLOW, DecisionTier.ACL, acl.id())
                : AccessDecision.deny(AccessReason.ACL_DEFAULT_DENY, DecisionTier.ACL, acl.id());
    }

    private Mono<AccessDecision> policyDecision(AccessCheck check) {
        return accessStore.policies()
                .flatMap(policies -> Mono.justOrEmpty(policies.policies().stream()
                        .filter(AccessPolicy::active)
                        .flatMap(policy -> policy.rules().stream()
                                .filter(rule -> rule.matches(check))
                                .limit(1)
                                .map(rule -> rule.effect() == Effect.ALLOW
                                        ? AccessDecision.allow(AccessReason.POLICY_ALLOW, DecisionTier.POLICY, policy.id())
                                        : AccessDecision.deny(AccessReason.POLICY_DENY, DecisionTier.POLICY, policy.id())))
                        .findFirst()));
    }
}
