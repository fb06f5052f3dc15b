package com.docvault.access;

import java.util.ArrayList;
import java.util.List;

/**
 * Index of the family groups a principal has joined, in join order, whatever their membership
 * status. {@link FamilyGroup} holds the status.
 */
public record GroupMemberships(String principalId, List<String> groupIds) {

    public GroupMemberships {
        groupIds = groupIds != null ? List.copyOf(groupIds) : List.of();
    }

    public static GroupMemberships empty(String principalId) {
        return new GroupMemberships(principalId, List.of());
    }

    public GroupMemberships with(String groupId) {
        if (groupIds.contains(groupId)) {
            return this;
        }
        List<String> next = new ArrayList<>(groupIds);
        next.add(groupId);
        return new GroupMemberships(principalId, next);
    }

    public GroupMemberships without(String groupId) {
        return new GroupMemberships(principalId,
                groupIds.stream().filter(id -> !id.equals(groupId)).toList());
    }
}
