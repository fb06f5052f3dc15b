package com.docvault.access;

import java.util.ArrayList;
import java.util.List;

/** Stored form of one principal's direct grants, in grant order. */
public record PrincipalGrants(String principalId, List<PermissionGrant> grants) {

    public PrincipalGrants {
        grants = grants != null ? List.copyOf(grants) : List.of();
    }

    public static PrincipalGrants empty(String principalId) {
        return new PrincipalGrants(principalId, List.of());
    }

    public PrincipalGrants with(PermissionGrant grant) {
        List<PermissionGrant> next = new ArrayList<>(grants);
        next.add(grant);
        return new PrincipalGrants(principalId, next);
    }

    public PrincipalGrants without(String grantId) {
        return new PrincipalGrants(principalId,
                grants.stream().filter(grant -> !grant.id().equals(grantId)).toList());
    }
}
