package com.docvault.access;

import com.docvault.audit.AuditTrail;
import com.docvault.crypto.CryptoService;
import com.docvault.store.EncryptedStore;
import com.docvault.store.InMemoryStoreBackend;
import com.docvault.support.MutableClock;
import com.docvault.support.TestStores;

/** Wires the access-control services over an in-memory store. */
final class AccessFixture {

    final MutableClock clock;
    final CryptoService crypto;
    final EncryptedStore store;
    final AccessStore accessStore;
    final AuditTrail auditTrail;
    final AccessControlService accessControl;
    final AccessEvaluator evaluator;

    AccessFixture(String startsAt) {
        clock = MutableClock.startingAt(startsAt);
        crypto = TestStores.crypto(clock);
        store = TestStores.store("access", new InMemoryStoreBackend(), crypto, clock);
        accessStore = new AccessStore(store);
        auditTrail = new AuditTrail(store, crypto, clock, 1000);
        accessControl = new AccessControlService(accessStore, auditTrail, crypto, clock);
        evaluator = new AccessEvaluator(accessStore, clock);
    }

    GrantRequest grant(String principalId, String resourceType, String resourceId, Action action) {
        return new GrantRequest(principalId, resourceType, resourceId, action, "admin", null, null);
    }

    AclEntryRequest entry(String principalId, PrincipalType type, Effect effect, Action... actions) {
        return new AclEntryRequest(principalId, type, effect, java.util.List.of(actions), "owner", null);
    }

    /** A group that admits every listed member as active. */
    String activeGroup(String owner, String... members) {
        FamilyGroup group = accessControl.createFamilyGroup(owner + "'s group", null, owner,
                new FamilyGroupSettings(true, true, FamilyGroupSettings.DEFAULT_MAX_MEMBERS)).block();
        for (String member : members) {
            accessControl.addGroupMember(group.id(), member, "member", null, owner).block();
        }
        return group.id();
    }

    AccessDecision check(AccessCheck check) {
        return evaluator.checkAccess(check).block();
    }
}
