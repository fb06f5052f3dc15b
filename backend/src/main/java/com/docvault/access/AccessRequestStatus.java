package com.docvault.access;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AccessRequestStatus {
    PENDING("pending"),
    APPROVED("approved"),
    DENIED("denied");

    private final String code;

    AccessRequestStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
