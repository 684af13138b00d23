package com.securityops.coordination.dto;

import jakarta.validation.constraints.NotBlank;

public record AcknowledgeRequest(
    @NotBlank(message = "User ID cannot be blank") String userId
) {
}
