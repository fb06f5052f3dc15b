package com.docvault.access;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.List;

public record FamilyMember(
        String id,
        String userId,
        String relationship,
        List<String> permissions,
        Instant joinedAt,
        String invitedBy,
        FamilyMemberStatus status
) {

    public FamilyMember {
        permissions = permissions != null ? List.copyOf(permissions) : List.of();
        status = status != null ? status : FamilyMemberStatus.PENDING;
    }

    @JsonIgnore
    public boolean isActive() {
        return status == FamilyMemberStatus.ACTIVE;
    }

    public FamilyMember activated() {
        return new FamilyMember(id, userId, relationship, permissions, joinedAt, invitedBy, FamilyMemberStatus.ACTIVE);
    }
}
