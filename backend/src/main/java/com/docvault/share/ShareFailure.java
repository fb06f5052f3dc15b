package com.docvault.share;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a share could not be used. Callers branch on these, so each has a distinct code; in
 * particular {@link #RESOURCE_GONE} (the token is fine, the document was deleted) is never
 * reported as {@link #NOT_FOUND} (no such token).
 */
public enum ShareFailure {
    NOT_FOUND("not_found"),
    REVOKED("revoked"),
    EXPIRED("expired"),
    ACCESS_EXHAUSTED("access_exhausted"),
    REQUIRES_PASSWORD("requires_password"),
    INVALID_CREDENTIALS("invalid_credentials"),
    BOT_BLOCKED("bot_blocked"),
    PERMISSION_DENIED("permission_denied"),
    RESOURCE_GONE("resource_gone"),
    UNAUTHORIZED("unauthorized");

    private final String code;

    ShareFailure(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
