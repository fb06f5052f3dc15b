package com.docvault.share;

/** A recipient presenting a share token. A null principal is recorded as {@code anonymous}. */
public record AccessAttempt(
        String principal,
        String password,
        ShareAction action,
        String sourceHint,
        String userAgent
) {

    public static final String ANONYMOUS = "anonymous";

    public AccessAttempt {
        principal = principal == null || principal.isBlank() ? ANONYMOUS : principal;
        action = action != null ? action : ShareAction.VIEW;
    }

    public static AccessAttempt view(String principal) {
        return new AccessAttempt(principal, null, ShareAction.VIEW, null, null);
    }

    public AccessAttempt withPassword(String password) {
        return new AccessAttempt(principal, password, action, sourceHint, userAgent);
    }
}
