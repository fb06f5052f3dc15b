package com.docvault.share;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AccessOutcome {
    SUCCESS("success"),
    FAILURE("failure");

    private final String code;

    AccessOutcome(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
