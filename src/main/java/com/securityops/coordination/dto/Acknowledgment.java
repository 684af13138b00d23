package com.securityops.coordination.dto;

import java.time.Instant;

public record Acknowledgment(String userId, Instant acknowledgedAt) {
}
