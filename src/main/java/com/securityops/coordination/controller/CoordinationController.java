package com.securityops.coordination.controller;

import com.securityops.coordination.service.alert.AlertEscalationEngine;
import com.securityops.coordination.service.broadcast.BroadcastRouter;
import com.securityops.coordination.service.location.GeofenceCacheService;
import com.securityops.coordination.service.registry.ConnectionRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;

/**
 * Operational endpoints: geofence cache maintenance and engine health.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Operations", description = "Geofence cache maintenance and engine health")
public class CoordinationController {

    private final GeofenceCacheService geofenceCacheService;
    private final ConnectionRegistry connectionRegistry;
    private final BroadcastRouter broadcastRouter;
    private final AlertEscalationEngine alertEngine;
    private final Clock clock;

    /**
     * Example:
     * GET /api/geofences/cache/stats
     */
    @Operation(
            summary = "Get geofence cache statistics",
            description = "Cached vs. active geofence count, and the share of lookups served without a database read."
    )
    @GetMapping("/api/geofences/cache/stats")
    public ResponseEntity<?> getCacheStats() {
        GeofenceCacheService.CacheStats stats = geofenceCacheService.getCacheStats();

        return ResponseEntity.ok(Map.of(
            "cachedGeofenceCount", stats.cachedGeofenceCount(),
            "databaseGeofenceCount", stats.databaseGeofenceCount(),
            "localHits", stats.localHits(),
            "redisHits", stats.redisHits(),
            "databaseLoads", stats.databaseLoads(),
            "cacheHealthy", stats.isCacheHealthy(),
            "cacheHitRate", String.format(Locale.ROOT, "%.1f%%", stats.cacheHitRate())
        ));
    }

    @Operation(summary = "Reload every active geofence into the cache")
    @PostMapping("/api/geofences/cache/refresh")
    public ResponseEntity<?> refreshCache() {
        int refreshedCount = geofenceCacheService.refreshAllGeofences();
        return ResponseEntity.ok(Map.of(
            "status", "SUCCESS",
            "message", "Cache refreshed",
            "geofencesRefreshed", refreshedCount
        ));
    }

    @Operation(summary = "Drop one geofence from the cache", description = "Call after editing a geofence in the database.")
    @PostMapping("/api/geofences/{geofenceId}/invalidate")
    public ResponseEntity<?> invalidate(@Parameter(description = "Geofence ID") @PathVariable Long geofenceId) {
        geofenceCacheService.invalidateGeofence(geofenceId);
        return ResponseEntity.ok(Map.of("status", "SUCCESS", "geofenceId", geofenceId));
    }

    @GetMapping("/api/coordination/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "service", "Location & Emergency-Alert Coordination Engine",
            "connectedSessions", connectionRegistry.sessionCount(),
            "connectedUsers", connectionRegistry.connectedUsers().size(),
            "activeAlerts", alertEngine.activeAlerts().size(),
            "queuedEvents", broadcastRouter.totalQueued(),
            "timestamp", clock.instant()
        ));
    }
}
