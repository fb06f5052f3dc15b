package com.docvault.access;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A family group: the {@code group} principal ACL entries name. Members join as
 * {@code pending} unless the group auto-approves them; only {@code active} members count as
 * belonging to the group.
 */
public record FamilyGroup(
        String id,
        String name,
        String description,
        String createdBy,
        List<FamilyMember> members,
        FamilyGroupSettings settings,
        Instant createdAt,
        Instant updatedAt
) {

    public static final String CREATOR_RELATIONSHIP = "creator";

    public FamilyGroup {
        members = members != null ? List.copyOf(members) : List.of();
        settings = settings != null ? settings : FamilyGroupSettings.defaults();
    }

    public Optional<FamilyMember> member(String userId) {
        return members.stream().filter(member -> member.userId().equals(userId)).findFirst();
    }

    public boolean hasActiveMember(String userId) {
        return member(userId).map(FamilyMember::isActive).orElse(false);
    }

    @JsonIgnore
    public boolean isFull() {
        return members.size() >= settings.maxMembers();
    }

    public FamilyGroup withMember(FamilyMember member, Instant now) {
        List<FamilyMember> next = new ArrayList<>(members);
        next.add(member);
        return new FamilyGroup(id, name, description, createdBy, next, settings, createdAt, now);
    }

    public FamilyGroup withoutMember(String userId, Instant now) {
        return new FamilyGroup(id, name, description, createdBy,
                members.stream().filter(member -> !member.userId().equals(userId)).toList(),
                settings, createdAt, now);
    }

    public FamilyGroup withActivatedMember(String userId, Instant now) {
        return new FamilyGroup(id, name, description, createdBy,
                members.stream()
                        .map(member -> member.userId().equals(userId) ? member.activated() : member)
                        .toList(),
                settings, createdAt, now);
    }
}
