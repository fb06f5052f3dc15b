package com.docvault.share;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/** What a share link lets its holder do: view only, view and download, or edit. */
public enum SharePermission {
    VIEW("view", EnumSet.of(ShareAction.VIEW)),
    DOWNLOAD("download", EnumSet.of(ShareAction.VIEW, ShareAction.DOWNLOAD)),
    EDIT("edit", EnumSet.of(ShareAction.VIEW, ShareAction.DOWNLOAD));

    private final String code;
    private final Set<ShareAction> allowed;

    SharePermission(String code, Set<ShareAction> allowed) {
        this.code = code;
        this.allowed = allowed;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean allows(ShareAction action) {
        return allowed.contains(action);
    }
}
