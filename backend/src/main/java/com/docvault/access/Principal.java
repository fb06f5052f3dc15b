package com.docvault.access;

import java.util.List;

/** Everything stored about one principal, assembled on demand. */
public record Principal(
        String principalId,
        List<RoleAssignment> roleAssignments,
        List<PermissionGrant> grants,
        List<String> groups
) {
}
