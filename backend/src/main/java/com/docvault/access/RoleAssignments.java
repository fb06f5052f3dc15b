package com.docvault.access;

import java.util.ArrayList;
import java.util.List;

public record RoleAssignments(String principalId, List<RoleAssignment> assignments) {

    public RoleAssignments {
        assignments = assignments != null ? List.copyOf(assignments) : List.of();
    }

    public static RoleAssignments empty(String principalId) {
        return new RoleAssignments(principalId, List.of());
    }

    public RoleAssignments with(RoleAssignment assignment) {
        List<RoleAssignment> next = new ArrayList<>(assignments);
        next.add(assignment);
        return new RoleAssignments(principalId, next);
    }

    public RoleAssignments without(String assignmentId) {
        return new RoleAssignments(principalId,
                assignments.stream().filter(a -> !a.id().equals(assignmentId)).toList());
    }
}
