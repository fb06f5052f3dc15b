package com.docvault.share;

import com.docvault.access.Action;
import com.fasterxml.jackson.annotation.JsonValue;

/** What a recipient does with a shared resource, and the access-control action it amounts to. */
public enum ShareAction {
    VIEW("view", Action.READ),
    DOWNLOAD("download", Action.DOWNLOAD);

    private final String code;
    private final Action action;

    ShareAction(String code, Action action) {
        this.code = code;
        this.action = action;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public Action action() {
        return action;
    }
}
