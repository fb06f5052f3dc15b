package com.docvault.access;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Effect {
    ALLOW("allow"),
    DENY("deny");

    private final String code;

    Effect(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
