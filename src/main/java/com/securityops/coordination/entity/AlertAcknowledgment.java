package com.securityops.coordination.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlertAcknowledgment {

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "acknowledged_at", nullable = false)
    private Instant acknowledgedAt;
}
