package com.docvault.share;

import com.fasterxml.jackson.annotation.JsonValue;

/** Share lifecycle. Every status other than {@link #ACTIVE} is terminal. */
public enum ShareStatus {
    ACTIVE("active"),
    EXPIRED("expired"),
    ACCESS_EXHAUSTED("access_exhausted"),
    REVOKED("revoked");

    private final String code;

    ShareStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
