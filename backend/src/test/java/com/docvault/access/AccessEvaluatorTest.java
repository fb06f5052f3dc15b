package com.docvault.access;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AccessEvaluatorTest {

    private AccessFixture fx;
    private AccessControlService accessControl;

    @BeforeEach
    void setup() {
        fx = new AccessFixture("2026-06-01T12:00:00Z");
        accessControl = fx.accessControl;
        accessControl.seedDefaultRoles().blockLast();
    }

    // ── Explicit grants ───────────────────────────────────────────────────────

    @Test
    void nothingStoredMeansNoMatchingPermission() {
        AccessDecision decision = fx.check(AccessCheck.of("nobody", Action.READ, "document", "doc-1"));

        assertFalse(decision.granted());
        assertEquals(AccessReason.NO_MATCHING_PERMISSION, decision.reason());
        assertEquals(DecisionTier.NONE, decision.policy());
    }

    @Test
    void explicitGrantIsScopedToResourceAndAction() {
        PermissionGrant grant = accessControl.grantPermission(fx.grant("alice", "document", "doc-1", Action.READ)).block();

        AccessDecision decision = fx.check(AccessCheck.of("alice", Action.READ, "document", "doc-1"));
        assertTrue(decision.granted());
        assertEquals(AccessReason.EXPLICIT_GRANT, decision.reason());
        assertEquals(DecisionTier.EXPLICIT, decision.policy());
        assertEquals(grant.id(), decision.detail());

        assertFalse(fx.check(AccessCheck.of("alice", Action.READ, "document", "doc-2")).granted());
        assertFalse(fx.check(AccessCheck.of("alice", Action.DELETE, "document", "doc-1")).granted());
        assertFalse(fx.check(AccessCheck.of("alice", Action.READ, "profile", "doc-1")).granted());
    }

    @Test
    void adminAllGrantAllowsEverything() {
        accessControl.grantPermission(fx.grant("root", "*", null, Action.ANY)).block();

        assertTrue(fx.check(AccessCheck.of("root", Action.DELETE, "document", "doc-1")).granted());
        assertTrue(fx.check(AccessCheck.of("root", Action.ADMIN, "family", null)).granted());
    }

    @Test
    void expiredGrantNoLongerApplies() {
        GrantRequest request = new GrantRequest("alice", "document", null, Action.READ, "admin",
                fx.clock.instant().plus(Duration.ofMinutes(1)), null);
        accessControl.grantPermission(request).block();

        assertTrue(fx.check(AccessCheck.of("alice", Action.READ, "document", "doc-1")).granted());

        fx.clock.advance(Duration.ofMinutes(1));
        assertFalse(fx.check(AccessCheck.of("alice", Action.READ, "document", "doc-1")).granted());
    }

    @Test
    void grantConditionsAreCheckedAgainstContext() {
        GrantRequest request = new GrantRequest("alice", "document", null, Action.UPDATE, "admin", null,
                List.of(new Condition("ownerId", ConditionOperator.EQUALS, "alice")));
        accessControl.grantPermission(request).block();

        AccessCheck own = new AccessCheck("doc-1", "document", Action.UPDATE, "alice", null, Map.of("ownerId", "alice"));
        AccessCheck foreign = new AccessCheck("doc-2", "document", Action.UPDATE, "alice", null, Map.of("ownerId", "bob"));

        assertTrue(fx.check(own).granted());
        assertFalse(fx.check(foreign).granted());
    }

    @Test
    void nonFiniteContextValueFailsConditionInsteadOfThrowing() {
        GrantRequest request = new GrantRequest("alice", "document", null, Action.READ, "admin", null,
                List.of(new Condition("score", ConditionOperator.GREATER_THAN, 2)));
        accessControl.grantPermission(request).block();

        AccessCheck check = new AccessCheck("doc-1", "document", Action.READ, "alice", null, Map.of("score", Double.NaN));
        AccessDecision decision = fx.check(check);

        assertFalse(decision.granted());
        assertEquals(AccessReason.NO_MATCHING_PERMISSION, decision.reason());
    }

    @Test
    void explicitGrantWinsOverAclDeny() {
        accessControl.createAcl("doc-1", "document", Effect.DENY, "owner").block();
        accessControl.addAclEntry("doc-1", fx.entry("alice", PrincipalType.USER, Effect.DENY, Action.READ)).block();
        accessControl.grantPermission(fx.grant("alice", "document", "doc-1", Action.READ)).block();

        AccessDecision decision = fx.check(AccessCheck.of("alice", Action.READ, "document", "doc-1"));

        assertTrue(decision.granted());
        assertEquals(AccessReason.EXPLICIT_GRANT, decision.reason());
    }

    // ── Roles ─────────────────────────────────────────────────────────────────

    @Test
    void roleTheCallerActsInGrantsItsPermissions() {
        AccessCheck asUser = new AccessCheck("doc-1", "document", Action.SHARE, "alice", AccessControlService.USER_ROLE, null);

        AccessDecision decision = fx.check(asUser);

        assertTrue(decision.granted());
        assertEquals(AccessReason.ROLE_PERMISSION, decision.reason());
        assertEquals(DecisionTier.ROLE, decision.policy());
        assertEquals("user:share_document", decision.detail());

        AccessCheck asGuest = new AccessCheck("doc-1", "document", Action.SHARE, "alice", AccessControlService.GUEST_ROLE, null);
        assertFalse(fx.check(asGuest).granted());
    }

    @Test
    void resourceScopedAssignmentOnlyAppliesToThatResource() {
        accessControl.assignRole("bob", AccessControlService.FAMILY_MEMBER_ROLE, "family-1", "owner", null).block();

        assertTrue(fx.check(AccessCheck.of("bob", Action.READ, "family", "family-1")).granted());
        assertFalse(fx.check(AccessCheck.of("bob", Action.READ, "family", "family-2")).granted());
    }

    @Test
    void adminRoleAssignmentCoversEveryResourceType() {
        accessControl.assignRole("root", AccessControlService.ADMIN_ROLE, null, "system", null).block();

        AccessDecision decision = fx.check(AccessCheck.of("root", Action.DELETE, "profile", "p-7"));

        assertTrue(decision.granted());
        assertEquals("admin:admin_all", decision.detail());
    }

    // ── ACL ───────────────────────────────────────────────────────────────────

    @Test
    void aclUserEntryIsConsultedBeforeGroupEntry() {
        String editors = fx.activeGroup("owner", "carol", "dave");
        accessControl.createAcl("doc-1", "document", Effect.DENY, "owner").block();
        accessControl.addAclEntry("doc-1", fx.entry(editors, PrincipalType.GROUP, Effect.ALLOW, Action.READ)).block();
        AclEntry carolDenied = accessControl.addAclEntry("doc-1",
                fx.entry("carol", PrincipalType.USER, Effect.DENY, Action.READ)).block();

        AccessDecision carol = fx.check(AccessCheck.of("carol", Action.READ, "document", "doc-1"));
        assertFalse(carol.granted());
        assertEquals(AccessReason.ACL_ENTRY_DENY, carol.reason());
        assertEquals(carolDenied.id(), carol.detail());

        AccessDecision dave = fx.check(AccessCheck.of("dave", Action.READ, "document", "doc-1"));
        assertTrue(dave.granted());
        assertEquals(AccessReason.ACL_ENTRY_ALLOW, dave.reason());
        assertEquals(DecisionTier.ACL, dave.policy());
    }

    @Test
    void aclRoleEntryIsConsultedBeforeGroupEntry() {
        String editors = fx.activeGroup("owner", "erin");
        accessControl.createAcl("doc-1", "document", Effect.DENY, "owner").block();
        accessControl.addAclEntry("doc-1", fx.entry(editors, PrincipalType.GROUP, Effect.ALLOW, Action.READ)).block();
        accessControl.addAclEntry("doc-1", fx.entry(AccessControlService.GUEST_ROLE, PrincipalType.ROLE, Effect.DENY, Action.ANY)).block();
        accessControl.assignRole("erin", AccessControlService.GUEST_ROLE, null, "owner", null).block();

        AccessDecision decision = fx.check(AccessCheck.of("erin", Action.READ, "document", "doc-1"));

        assertFalse(decision.granted());
        assertEquals(AccessReason.ACL_ENTRY_DENY, decision.reason());
    }

    @Test
    void pendingGroupMemberIsNotCoveredByGroupEntry() {
        FamilyGroup family = accessControl.createFamilyGroup("Smiths", null, "owner",
                FamilyGroupSettings.defaults()).block();
        accessControl.addGroupMember(family.id(), "ivy", "cousin", null, "owner").block();
        accessControl.createAcl("doc-1", "document", Effect.DENY, "owner").block();
        accessControl.addAclEntry("doc-1", fx.entry(family.id(), PrincipalType.GROUP, Effect.ALLOW, Action.READ)).block();

        AccessDecision pending = fx.check(AccessCheck.of("ivy", Action.READ, "document", "doc-1"));
        assertFalse(pending.granted());
        assertEquals(AccessReason.ACL_DEFAULT_DENY, pending.reason());

        accessControl.approveGroupMember(family.id(), "ivy", "owner").block();

        AccessDecision active = fx.check(AccessCheck.of("ivy", Action.READ, "document", "doc-1"));
        assertTrue(active.granted());
        assertEquals(AccessReason.ACL_ENTRY_ALLOW, active.reason());

        accessControl.removeGroupMember(family.id(), "ivy", "owner").block();
        assertFalse(fx.check(AccessCheck.of("ivy", Action.READ, "document", "doc-1")).granted());
    }

    @Test
    void earlierEntryForSamePrincipalWins() {
        accessControl.createAcl("doc-1", "document", Effect.DENY, "owner").block();
        AclEntry allow = accessControl.addAclEntry("doc-1", fx.entry("jack", PrincipalType.USER, Effect.ALLOW, Action.READ)).block();
        accessControl.addAclEntry("doc-1", fx.entry("jack", PrincipalType.USER, Effect.DENY, Action.READ)).block();

        AccessDecision decision = fx.check(AccessCheck.of("jack", Action.READ, "document", "doc-1"));

        assertTrue(decision.granted());
        assertEquals(AccessReason.ACL_ENTRY_ALLOW, decision.reason());
        assertEquals(allow.id(), decision.detail());
    }

    @Test
    void earlierDenyForSamePrincipalWinsOverLaterAllow() {
        accessControl.createAcl("doc-1", "document", Effect.ALLOW, "owner").block();
        AclEntry deny = accessControl.addAclEntry("doc-1", fx.entry("kate", PrincipalType.USER, Effect.DENY, Action.READ)).block();
        accessControl.addAclEntry("doc-1", fx.entry("kate", PrincipalType.USER, Effect.ALLOW, Action.READ)).block();

        AccessDecision decision = fx.check(AccessCheck.of("kate", Action.READ, "document", "doc-1"));

        assertFalse(decision.granted());
        assertEquals(AccessReason.ACL_ENTRY_DENY, decision.reason());
        assertEquals(deny.id(), decision.detail());
    }

    @Test
    void expiredEarlierEntryIsSkippedForLaterOne() {
        accessControl.createAcl("doc-1", "document", Effect.ALLOW, "owner").block();
        accessControl.addAclEntry("doc-1", new AclEntryRequest("liam", PrincipalType.USER, Effect.ALLOW,
                List.of(Action.READ), "owner", fx.clock.instant().plus(Duration.ofMinutes(30)))).block();
        AclEntry deny = accessControl.addAclEntry("doc-1", fx.entry("liam", PrincipalType.USER, Effect.DENY, Action.READ)).block();

        assertEquals(AccessReason.ACL_ENTRY_ALLOW, fx.check(AccessCheck.of("liam", Action.READ, "document", "doc-1")).reason());

        fx.clock.advance(Duration.ofMinutes(30));
        AccessDecision decision = fx.check(AccessCheck.of("liam", Action.READ, "document", "doc-1"));
        assertFalse(decision.granted());
        assertEquals(AccessReason.ACL_ENTRY_DENY, decision.reason());
        assertEquals(deny.id(), decision.detail());
    }

    @Test
    void aclDefaultAllowGrantsAccess() {
        accessControl.createAcl("doc-1", "document", Effect.ALLOW, "owner").block();

        AccessDecision decision = fx.check(AccessCheck.of("anyone", Action.READ, "document", "doc-1"));

        assertTrue(decision.granted());
        assertEquals(AccessReason.ACL_DEFAULT_ALLOW, decision.reason());
    }

    @Test
    void aclForAnotherResourceTypeIsIgnored() {
        accessControl.createAcl("doc-1", "document", Effect.ALLOW, "owner").block();

        assertEquals(AccessReason.NO_MATCHING_PERMISSION,
                fx.check(AccessCheck.of("anyone", Action.READ, "profile", "doc-1")).reason());
    }

    @Test
    void expiredAclEntryFallsBackToDefault() {
        accessControl.createAcl("doc-1", "document", Effect.DENY, "owner").block();
        AclEntryRequest shortLived = new AclEntryRequest("frank", PrincipalType.USER, Effect.ALLOW,
                List.of(Action.READ), "owner", fx.clock.instant().plus(Duration.ofHours(1)));
        accessControl.addAclEntry("doc-1", shortLived).block();

        assertTrue(fx.check(AccessCheck.of("frank", Action.READ, "document", "doc-1")).granted());

        fx.clock.advance(Duration.ofHours(2));
        AccessDecision decision = fx.check(AccessCheck.of("frank", Action.READ, "document", "doc-1"));
        assertFalse(decision.granted());
        assertEquals(AccessReason.ACL_DEFAULT_DENY, decision.reason());
        assertEquals(DecisionTier.ACL, decision.policy());
    }

    // ── Policies ──────────────────────────────────────────────────────────────

    @Test
    void aclDefaultDenyFallsThroughToPolicy() {
        accessControl.createAcl("doc-1", "document", Effect.DENY, "owner").block();
        accessControl.definePolicy(new AccessPolicy("hr-read", "HR reads", null, true,
                List.of(new PolicyRule("document", Action.READ,
                        List.of(new Condition("department", ConditionOperator.EQUALS, "hr")), Effect.ALLOW)),
                null), "admin").block();

        AccessCheck fromHr = new AccessCheck("doc-1", "document", Action.READ, "gina", null, Map.of("department", "hr"));
        AccessDecision allowed = fx.check(fromHr);
        assertTrue(allowed.granted());
        assertEquals(AccessReason.POLICY_ALLOW, allowed.reason());
        assertEquals("hr-read", allowed.detail());

        AccessDecision denied = fx.check(AccessCheck.of("gina", Action.READ, "document", "doc-1"));
        assertFalse(denied.granted());
        assertEquals(AccessReason.ACL_DEFAULT_DENY, denied.reason());
    }

    @Test
    void firstMatchingRuleOfFirstActivePolicyDecides() {
        accessControl.definePolicy(new AccessPolicy("lockdown", "Lockdown", null, true,
                List.of(new PolicyRule("*", Action.DELETE, null, Effect.DENY)), null), "admin").block();
        accessControl.definePolicy(new AccessPolicy("open", "Open", null, true,
                List.of(new PolicyRule("*", Action.ANY, null, Effect.ALLOW)), null), "admin").block();

        AccessDecision delete = fx.check(AccessCheck.of("henry", Action.DELETE, "document", null));
        assertFalse(delete.granted());
        assertEquals(AccessReason.POLICY_DENY, delete.reason());
        assertTrue(delete.reason().isExplicitDenial());

        assertEquals(AccessReason.POLICY_ALLOW, fx.check(AccessCheck.of("henry", Action.READ, "document", null)).reason());

        accessControl.deactivatePolicy("lockdown", "admin").block();
        assertTrue(fx.check(AccessCheck.of("henry", Action.DELETE, "document", null)).granted());
    }

    @Test
    void checkRequiresPrincipalTypeAndConcreteAction() {
        assertThrows(IllegalArgumentException.class, () -> AccessCheck.of(" ", Action.READ, "document", "d"));
        assertThrows(IllegalArgumentException.class, () -> AccessCheck.of("a", Action.READ, null, "d"));
        assertThrows(IllegalArgumentException.class, () -> AccessCheck.of("a", Action.ANY, "document", "d"));
    }
}
