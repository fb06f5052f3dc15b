package com.docvault.access;

import com.fasterxml.jackson.annotation.JsonValue;

/** Actions a principal can attempt on a resource. {@link #ANY} is a wildcard for rules only. */
public enum Action {
    READ("read"),
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete"),
    SHARE("share"),
    DOWNLOAD("download"),
    ADMIN("admin"),
    ANY("*");

    private final String code;

    Action(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** True if a rule carrying this action applies to a request for {@code requested}. */
    public boolean covers(Action requested) {
        return this == ANY || this == requested;
    }
}
