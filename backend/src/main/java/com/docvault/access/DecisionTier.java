package com.docvault.access;

import com.fasterxml.jackson.annotation.JsonValue;

/** The evaluation tier that produced a decision. */
public enum DecisionTier {
    EXPLICIT("explicit"),
    ROLE("role"),
    ACL("acl"),
    POLICY("policy"),
    NONE("none");

    private final String code;

    DecisionTier(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
