package com.securityops.coordination.dto;

import java.time.Instant;

public record Resolution(String userId, Instant resolvedAt, String notes, ResolutionOutcome outcome) {
}
