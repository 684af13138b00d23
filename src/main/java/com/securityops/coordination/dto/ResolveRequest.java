package com.securityops.coordination.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResolveRequest(
    @NotBlank(message = "User ID cannot be blank") String userId,
    @Size(max = 4000, message = "Notes must be at most 4000 characters") String notes,
    ResolutionOutcome outcome
) {

    public ResolutionOutcome outcomeOrDefault() {
        return outcome == null ? ResolutionOutcome.RESOLVED : outcome;
    }
}
