package com.docvault.access;

import com.docvault.audit.AuditAction;
import com.docvault.audit.AuditEntry;
import com.docvault.exception.InvalidStateException;
import com.docvault.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccessControlServiceTest {

    private AccessFixture fx;
    private AccessControlService accessControl;

    @BeforeEach
    void setup() {
        fx = new AccessFixture("2026-06-01T12:00:00Z");
        accessControl = fx.accessControl;
    }

    private List<AuditAction> auditedActions() {
        return fx.auditTrail.entries().map(AuditEntry::action).collectList().block();
    }

    @Test
    void seedingDefinesOnlyMissingRoles() {
        StepVerifier.create(accessControl.seedDefaultRoles().map(Role::id))
                .expectNext("admin", "user", "family_member", "guest")
                .verifyComplete();

        StepVerifier.create(accessControl.seedDefaultRoles()).verifyComplete();

        StepVerifier.create(accessControl.roles().map(Role::hierarchyLevel).collectList())
                .assertNext(levels -> assertEquals(List.of(100, 5, 1, 10), levels))
                .verifyComplete();
    }

    @Test
    void everyMutationIsAudited() {
        accessControl.seedDefaultRoles().blockLast();
        PermissionGrant grant = accessControl.grantPermission(fx.grant("alice", "document", "doc-1", Action.READ)).block();
        accessControl.revokePermission("alice", grant.id(), "admin").block();
        accessControl.assignRole("alice", "user", null, "admin", null).block();
        FamilyGroup family = accessControl.createFamilyGroup("Smiths", null, "admin", FamilyGroupSettings.defaults()).block();
        accessControl.addGroupMember(family.id(), "alice", "sibling", null, "admin").block();
        accessControl.createAcl("doc-1", "document", null, "alice").block();
        accessControl.addAclEntry("doc-1", fx.entry("bob", PrincipalType.USER, Effect.ALLOW, Action.READ)).block();
        accessControl.definePolicy(new AccessPolicy("p1", "P1", null, true, List.of(), null), "admin").block();
        accessControl.deactivatePolicy("p1", "admin").block();

        List<AuditAction> actions = auditedActions();
        assertEquals(List.of(
                AuditAction.ROLE_DEFINED, AuditAction.ROLE_DEFINED, AuditAction.ROLE_DEFINED, AuditAction.ROLE_DEFINED,
                AuditAction.PERMISSION_GRANTED,
                AuditAction.PERMISSION_REVOKED,
                AuditAction.ROLE_ASSIGNED,
                AuditAction.FAMILY_GROUP_CREATED,
                AuditAction.GROUP_MEMBER_ADDED,
                AuditAction.ACL_CREATED,
                AuditAction.ACL_ENTRY_ADDED,
                AuditAction.POLICY_DEFINED,
                AuditAction.POLICY_DEACTIVATED), actions);

        AuditEntry granted = fx.auditTrail.entriesFor("alice")
                .filter(entry -> entry.action() == AuditAction.PERMISSION_GRANTED)
                .blockFirst();
        assertEquals("read_document", granted.details().get("permission"));
        assertEquals(grant.id(), granted.details().get("grantId"));
    }

    @Test
    void revokingRemovesOnlyThatGrant() {
        PermissionGrant read = accessControl.grantPermission(fx.grant("alice", "document", null, Action.READ)).block();
        accessControl.grantPermission(fx.grant("alice", "document", null, Action.UPDATE)).block();

        StepVerifier.create(accessControl.revokePermission("alice", read.id(), "admin"))
                .expectNext(true)
                .verifyComplete();
        StepVerifier.create(accessControl.revokePermission("alice", read.id(), "admin"))
                .expectNext(false)
                .verifyComplete();

        StepVerifier.create(accessControl.effectivePermissions("alice"))
                .expectNext(List.of("update_document"))
                .verifyComplete();
    }

    @Test
    void effectivePermissionsMergeGrantsAndGlobalRoles() {
        accessControl.seedDefaultRoles().blockLast();
        accessControl.grantPermission(fx.grant("alice", "document", "doc-1", Action.DOWNLOAD)).block();
        accessControl.grantPermission(new GrantRequest("alice", "family", null, Action.READ, "admin",
                fx.clock.instant().plus(Duration.ofMinutes(5)), null)).block();
        accessControl.assignRole("alice", "user", null, "admin", null).block();
        accessControl.assignRole("alice", "family_member", "family-1", "admin", null).block();

        StepVerifier.create(accessControl.effectivePermissions("alice"))
                .expectNext(List.of("download_document", "read_family", "read_profile", "share_document", "update_profile"))
                .verifyComplete();

        fx.clock.advance(Duration.ofMinutes(10));
        StepVerifier.create(accessControl.effectivePermissions("alice"))
                .expectNext(List.of("download_document", "read_profile", "share_document", "update_profile"))
                .verifyComplete();
    }

    @Test
    void assigningUnknownRoleFails() {
        StepVerifier.create(accessControl.assignRole("alice", "wizard", null, "admin", null))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void unassigningRoleRemovesIt() {
        accessControl.seedDefaultRoles().blockLast();
        RoleAssignment assignment = accessControl.assignRole("alice", "admin", null, "system", null).block();

        StepVerifier.create(accessControl.unassignRole("alice", assignment.id(), "system"))
                .expectNext(true)
                .verifyComplete();
        StepVerifier.create(accessControl.describePrincipal("alice"))
                .assertNext(principal -> assertTrue(principal.roleAssignments().isEmpty()))
                .verifyComplete();
    }

    @Test
    void secondAclForSameResourceIsRejected() {
        accessControl.createAcl("doc-1", "document", Effect.ALLOW, "alice").block();

        StepVerifier.create(accessControl.createAcl("doc-1", "document", Effect.DENY, "mallory"))
                .expectError(InvalidStateException.class)
                .verify();
        assertEquals(Effect.ALLOW, accessControl.acl("doc-1").block().defaultEffect());
    }

    @Test
    void aclEntriesKeepInsertionOrderAndCanBeRemoved() {
        AccessControlList created = accessControl.createAcl("doc-1", "document", null, "alice").block();
        assertEquals(Effect.DENY, created.defaultEffect());

        AclEntry first = accessControl.addAclEntry("doc-1", fx.entry("bob", PrincipalType.USER, Effect.ALLOW, Action.READ)).block();
        AclEntry second = accessControl.addAclEntry("doc-1", fx.entry("team", PrincipalType.GROUP, Effect.DENY, Action.ANY)).block();

        assertEquals(List.of(first.id(), second.id()),
                accessControl.acl("doc-1").block().entries().stream().map(AclEntry::id).toList());

        StepVerifier.create(accessControl.removeAclEntry("doc-1", first.id(), "alice"))
                .expectNext(true)
                .verifyComplete();
        assertEquals(List.of(second.id()),
                accessControl.acl("doc-1").block().entries().stream().map(AclEntry::id).toList());
    }

    @Test
    void entryOnMissingAclFails() {
        StepVerifier.create(accessControl.addAclEntry("nope", fx.entry("bob", PrincipalType.USER, Effect.ALLOW, Action.READ)))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void redefiningPolicyReplacesItInPlace() {
        accessControl.definePolicy(new AccessPolicy("a", "A", null, true, List.of(), null), "admin").block();
        accessControl.definePolicy(new AccessPolicy("b", "B", null, true, List.of(), null), "admin").block();
        accessControl.definePolicy(new AccessPolicy("a", "A v2", null, true, List.of(), null), "admin").block();

        StepVerifier.create(accessControl.policies().map(AccessPolicy::name))
                .expectNext("A v2", "B")
                .verifyComplete();
        StepVerifier.create(accessControl.deactivatePolicy("missing", "admin"))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void creatorIsTheFirstActiveAdminMember() {
        FamilyGroup family = accessControl.createFamilyGroup("Smiths", "Household", "alice",
                FamilyGroupSettings.defaults()).block();

        assertEquals(1, family.members().size());
        FamilyMember creator = family.members().get(0);
        assertEquals("alice", creator.userId());
        assertEquals(FamilyGroup.CREATOR_RELATIONSHIP, creator.relationship());
        assertEquals(List.of(AccessControlService.ADMIN_ROLE), creator.permissions());
        assertTrue(creator.isActive());
        assertEquals(FamilyGroupSettings.DEFAULT_MAX_MEMBERS, family.settings().maxMembers());

        StepVerifier.create(accessControl.describePrincipal("alice").map(Principal::groups))
                .expectNext(List.of(family.id()))
                .verifyComplete();
    }

    @Test
    void membersStayPendingUntilApproved() {
        FamilyGroup family = accessControl.createFamilyGroup("Smiths", null, "alice",
                FamilyGroupSettings.defaults()).block();

        FamilyGroup withBob = accessControl.addGroupMember(family.id(), "bob", "brother", null, "alice").block();
        FamilyMember bob = withBob.member("bob").orElseThrow();
        assertEquals(FamilyMemberStatus.PENDING, bob.status());
        assertEquals(List.of("view"), bob.permissions());
        assertEquals(List.of(), fx.accessStore.activeGroupIds("bob").block());

        FamilyGroup approved = accessControl.approveGroupMember(family.id(), "bob", "alice").block();
        assertTrue(approved.hasActiveMember("bob"));
        assertEquals(List.of(family.id()), fx.accessStore.activeGroupIds("bob").block());
        assertTrue(auditedActions().contains(AuditAction.GROUP_MEMBER_APPROVED));
    }

    @Test
    void autoApprovingGroupActivatesMembersImmediately() {
        FamilyGroup family = accessControl.createFamilyGroup("Open house", null, "alice",
                new FamilyGroupSettings(true, true, 10)).block();

        FamilyGroup updated = accessControl.addGroupMember(family.id(), "bob", "friend", List.of("view", "comment"), "alice").block();

        assertTrue(updated.hasActiveMember("bob"));
        assertEquals(List.of("view", "comment"), updated.member("bob").orElseThrow().permissions());
    }

    @Test
    void fullGroupRejectsNewMembers() {
        FamilyGroup family = accessControl.createFamilyGroup("Pair", null, "alice",
                new FamilyGroupSettings(true, true, 2)).block();
        accessControl.addGroupMember(family.id(), "bob", "partner", null, "alice").block();

        StepVerifier.create(accessControl.addGroupMember(family.id(), "carol", "friend", null, "alice"))
                .expectError(InvalidStateException.class)
                .verify();
        assertEquals(2, accessControl.familyGroup(family.id()).block().members().size());
    }

    @Test
    void duplicateMemberIsRejected() {
        FamilyGroup family = accessControl.createFamilyGroup("Smiths", null, "alice",
                FamilyGroupSettings.defaults()).block();

        StepVerifier.create(accessControl.addGroupMember(family.id(), "alice", "again", null, "alice"))
                .expectError(InvalidStateException.class)
                .verify();
    }

    @Test
    void removingMemberIsAuditedAndDropsMembership() {
        FamilyGroup family = accessControl.createFamilyGroup("Smiths", null, "alice",
                new FamilyGroupSettings(true, true, 5)).block();
        accessControl.addGroupMember(family.id(), "bob", "brother", null, "alice").block();

        FamilyGroup updated = accessControl.removeGroupMember(family.id(), "bob", "alice").block();

        assertTrue(updated.member("bob").isEmpty());
        assertEquals(List.of(), fx.accessStore.groups("bob").block().groupIds());
        AuditEntry removal = fx.auditTrail.entriesFor(family.id())
                .filter(entry -> entry.action() == AuditAction.GROUP_MEMBER_REMOVED)
                .blockFirst();
        assertNotNull(removal);
        assertEquals("alice", removal.actor());
        assertEquals("bob", removal.details().get("userId"));

        StepVerifier.create(accessControl.removeGroupMember(family.id(), "bob", "alice"))
                .expectError(ResourceNotFoundException.class)
                .verify();
        StepVerifier.create(accessControl.addGroupMember("family_missing", "bob", "brother", null, "alice"))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void groupSettingsRequirePositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new FamilyGroupSettings(false, true, 0));
    }

    @Test
    void grantRequiresPrincipalAndType() {
        assertThrows(IllegalArgumentException.class,
                () -> accessControl.grantPermission(fx.grant(null, "document", null, Action.READ)));
        assertThrows(IllegalArgumentException.class,
                () -> accessControl.grantPermission(fx.grant("alice", "", null, Action.READ)));
    }
}
