package com.docvault.access;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;

public record AclEntryRequest(
        @NotBlank(message = "principalId is required") String principalId,
        @NotNull(message = "principalType is required") PrincipalType principalType,
        @NotNull(message = "effect is required") Effect effect,
        @NotEmpty(message = "at least one action is required") List<Action> actions,
        String grantedBy,
        Instant expiresAt
) {
}
