package com.docvault.access;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Per-resource allow/deny list. Entries keep insertion order; evaluation takes the first
 * non-expired entry that names the principal (by user, then role, then group) and covers the
 * action, and falls back to {@code defaultEffect}.
 */
public record AccessControlList(
        String id,
        String resourceId,
        String resourceType,
        List<AclEntry> entries,
        Effect defaultEffect,
        Instant createdAt,
        Instant updatedAt
) {

    public AccessControlList {
        entries = entries != null ? List.copyOf(entries) : List.of();
        defaultEffect = defaultEffect != null ? defaultEffect : Effect.DENY;
    }

    public AccessControlList withEntry(AclEntry entry, Instant now) {
        List<AclEntry> next = new ArrayList<>(entries);
        next.add(entry);
        return new AccessControlList(id, resourceId, resourceType, next, defaultEffect, createdAt, now);
    }

    public AccessControlList withoutEntry(String entryId, Instant now) {
        return new AccessControlList(id, resourceId, resourceType,
                entries.stream().filter(entry -> !entry.id().equals(entryId)).toList(),
                defaultEffect, createdAt, now);
    }

    public Optional<AclEntry> firstMatch(PrincipalType type, Collection<String> principalIds,
                                         Action action, Instant now) {
        return entries.stream()
                .filter(entry -> entry.principalType() == type)
                .filter(entry -> principalIds.contains(entry.principalId()))
                .filter(entry -> !entry.isExpired(now))
                .filter(entry -> entry.covers(action))
                .findFirst();
    }
}
