package com.securityops.coordination.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * STOMP payload for acknowledging or resolving an alert; the acting user comes from the session.
 */
public record AlertActionMessage(
    @NotBlank String alertId,
    String notes,
    ResolutionOutcome outcome
) {
}
