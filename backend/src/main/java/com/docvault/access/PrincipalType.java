package com.docvault.access;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PrincipalType {
    USER("user"),
    ROLE("role"),
    GROUP("group");

    private final String code;

    PrincipalType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
