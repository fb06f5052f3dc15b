package com.docvault.access;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AccessReason {
    EXPLICIT_GRANT("explicit_grant"),
    ROLE_PERMISSION("role_permission"),
    ACL_ENTRY_ALLOW("acl_entry_allow"),
    ACL_ENTRY_DENY("acl_entry_deny"),
    ACL_DEFAULT_ALLOW("acl_default_allow"),
    ACL_DEFAULT_DENY("acl_default_deny"),
    POLICY_ALLOW("policy_allow"),
    POLICY_DENY("policy_deny"),
    NO_MATCHING_PERMISSION("no_matching_permission");

    private final String code;

    AccessReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** True for denials that come from a rule naming the request, not from a fallback. */
    public boolean isExplicitDenial() {
        return this == ACL_ENTRY_DENY || this == POLICY_DENY;
    }
}
