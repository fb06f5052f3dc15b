package com.docvault.access;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;

/** Input to {@link AccessControlService#grantPermission}. {@code resourceId} null means every resource of the type. */
public record GrantRequest(
        @NotBlank(message = "principalId is required") String principalId,
        @NotBlank(message = "resourceType is required") String resourceType,
        String resourceId,
        @NotNull(message = "action is required") Action action,
        String grantedBy,
        Instant expiresAt,
        List<Condition> conditions
) {
}
