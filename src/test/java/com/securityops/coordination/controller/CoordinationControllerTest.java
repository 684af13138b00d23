package com.securityops.coordination.controller;

import com.securityops.coordination.service.alert.AlertEscalationEngine;
import com.securityops.coordination.service.broadcast.BroadcastRouter;
import com.securityops.coordination.service.location.GeofenceCacheService;
import com.securityops.coordination.service.registry.ConnectionRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CoordinationController.class)
@Import(CoordinationControllerTest.FixedClockConfig.class)
class CoordinationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GeofenceCacheService geofenceCacheService;

    @MockBean
    private ConnectionRegistry connectionRegistry;

    @MockBean
    private BroadcastRouter broadcastRouter;

    @MockBean
    private AlertEscalationEngine alertEngine;

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2024-06-03T10:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Test
    void shouldReturnHealthy() throws Exception {
        when(connectionRegistry.sessionCount()).thenReturn(3);
        when(connectionRegistry.connectedUsers()).thenReturn(Set.of("u-1", "u-2"));
        when(alertEngine.activeAlerts()).thenReturn(List.of());
        when(broadcastRouter.totalQueued()).thenReturn(7);

        mockMvc.perform(get("/api/coordination/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.connectedSessions").value(3))
                .andExpect(jsonPath("$.connectedUsers").value(2))
                .andExpect(jsonPath("$.activeAlerts").value(0))
                .andExpect(jsonPath("$.queuedEvents").value(7));
    }

    @Test
    void shouldGetCacheStatistics() throws Exception {
        when(geofenceCacheService.getCacheStats())
                .thenReturn(new GeofenceCacheService.CacheStats(4, 4, 90, 5, 5));

        mockMvc.perform(get("/api/geofences/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cacheHealthy").value(true))
                .andExpect(jsonPath("$.cacheHitRate").value("95.0%"));
    }

    @Test
    void shouldRefreshCache() throws Exception {
        when(geofenceCacheService.refreshAllGeofences()).thenReturn(4);

        mockMvc.perform(post("/api/geofences/cache/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.geofencesRefreshed").value(4));
    }

    @Test
    void shouldInvalidateOneGeofence() throws Exception {
        mockMvc.perform(post("/api/geofences/12/invalidate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.geofenceId").value(12));

        verify(geofenceCacheService).invalidateGeofence(12L);
    }
}
