package com.docvault.audit;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditAction {
    PERMISSION_GRANTED("permission.granted"),
    PERMISSION_REVOKED("permission.revoked"),
    ROLE_DEFINED("role.defined"),
    ROLE_ASSIGNED("role.assigned"),
    ROLE_UNASSIGNED("role.unassigned"),
    FAMILY_GROUP_CREATED("group.created"),
    GROUP_MEMBER_ADDED("group.member_added"),
    GROUP_MEMBER_APPROVED("group.member_approved"),
    GROUP_MEMBER_REMOVED("group.member_removed"),
    ACL_CREATED("acl.created"),
    ACL_ENTRY_ADDED("acl.entry_added"),
    ACL_ENTRY_REMOVED("acl.entry_removed"),
    POLICY_DEFINED("policy.defined"),
    POLICY_DEACTIVATED("policy.deactivated"),
    ACCESS_REQUESTED("access_request.created"),
    ACCESS_REQUEST_APPROVED("access_request.approved"),
    ACCESS_REQUEST_DENIED("access_request.denied"),
    SHARE_CREATED("share.created"),
    SHARE_REVOKED("share.revoked"),
    RESOURCE_DELETED("resource.deleted");

    private final String code;

    AuditAction(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
