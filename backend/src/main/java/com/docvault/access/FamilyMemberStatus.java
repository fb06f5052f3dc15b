package com.docvault.access;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FamilyMemberStatus {
    PENDING("pending"),
    ACTIVE("active");

    private final String code;

    FamilyMemberStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
