package com.docvault.access;

/**
 * @param autoApproveMembers new members start {@code active} instead of {@code pending}
 * @param maxMembers         capacity, the creator included
 */
public record FamilyGroupSettings(boolean autoApproveMembers, boolean allowMemberInvites, int maxMembers) {

    public static final int DEFAULT_MAX_MEMBERS = 50;

    public FamilyGroupSettings {
        if (maxMembers < 1) {
            throw new IllegalArgumentException("maxMembers must be positive");
        }
    }

    public static FamilyGroupSettings defaults() {
        return new FamilyGroupSettings(false, true, DEFAULT_MAX_MEMBERS);
    }
}
