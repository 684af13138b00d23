package com.securityops.coordination.config;

import com.securityops.coordination.dto.AlertPriority;
import com.securityops.coordination.dto.AlertType;
import com.securityops.coordination.dto.Role;
import com.securityops.coordination.dto.ViolationSeverity;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunable parameters of the coordination engine, bound from the {@code coordination.*} namespace.
 *
 * All timing values (escalation tiers, cooldowns, retention windows) are configuration,
 * the defaults below only mirror the values the operations team started with.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "coordination")
public class CoordinationProperties {

    private final Location location = new Location();
    private final Geofence geofence = new Geofence();
    private final Escalation escalation = new Escalation();
    private final Broadcast broadcast = new Broadcast();
    private final Session session = new Session();
    private final Audit audit = new Audit();
    private final Auth auth = new Auth();

    @Data
    public static class Location {
        /** Samples reporting a worse accuracy than this are discarded. */
        @Positive
        private double accuracyCeilingMeters = 50.0;
        /** Age after which the last known position is reported as stale. */
        @NotNull
        private Duration freshnessWindow = Duration.ofMinutes(2);
        /** How long a latest-per-agent entry is kept without a new sample. */
        @NotNull
        private Duration latestTtl = Duration.ofMinutes(5);
        @NotNull
        private Duration maxClockSkew = Duration.ofMinutes(1);
        @NotNull
        private Duration historyRetention = Duration.ofDays(30);
    }

    @Data
    public static class Geofence {
        @NotNull
        private Duration violationCooldown = Duration.ofMinutes(5);
        @NotNull
        private ViolationSeverity alertMinSeverity = ViolationSeverity.LOW;
        @PositiveOrZero
        private double alertMinDistanceMeters = 0.0;
        @NotNull
        private AlertType alertType = AlertType.SECURITY;
        @NotNull
        private Duration cacheTtl = Duration.ofMinutes(60);
    }

    @Data
    public static class Escalation {
        private List<Tier> tiers = new ArrayList<>(List.of(
                new Tier(0, Duration.ZERO, new ArrayList<>(List.of("site:{siteId}"))),
                new Tier(1, Duration.ofMinutes(5), new ArrayList<>(List.of("role:SUPERVISOR"))),
                new Tier(2, Duration.ofMinutes(15), new ArrayList<>(List.of("role:ADMIN")))
        ));
        /** Extra rooms notified at level 0 for HIGH priority alerts. */
        private List<String> highPriorityRooms = new ArrayList<>(List.of("monitoring"));
        /** Priority for alert types that are not life-safety (PANIC, MEDICAL, FIRE are always HIGH). */
        @NotNull
        private AlertPriority defaultPriority = AlertPriority.NORMAL;
        /** How long resolved alerts stay in memory so duplicate client retries see the same record. */
        @NotNull
        private Duration closedAlertRetention = Duration.ofHours(1);

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        public static class Tier {
            private int level;
            /** Offset from alert creation at which this tier is reached. */
            private Duration offset = Duration.ZERO;
            /** Room templates; {siteId} and {agentId} are substituted per alert. */
            private List<String> rooms = new ArrayList<>();
        }
    }

    @Data
    public static class Broadcast {
        @NotNull
        private Duration locationRetention = Duration.ofHours(24);
        @NotNull
        private Duration alertRetention = Duration.ofDays(7);
        @Positive
        private int maxQueuedPerRecipient = 1000;
    }

    @Data
    public static class Session {
        @NotNull
        private Duration idleTimeout = Duration.ofSeconds(90);
    }

    @Data
    public static class Audit {
        @Positive
        private int maxAttempts = 5;
        @NotNull
        private Duration initialBackoff = Duration.ofMillis(500);
        @Positive
        private double backoffMultiplier = 2.0;
        @Positive
        private int workerThreads = 2;
    }

    @Data
    public static class Auth {
        private List<StaticToken> staticTokens = new ArrayList<>();

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        public static class StaticToken {
            private String token;
            private String userId;
            private Role role;
            private String agentId;
            private String clientId;
        }
    }
}
