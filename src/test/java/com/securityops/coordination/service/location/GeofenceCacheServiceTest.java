package com.securityops.coordination.service.location;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.securityops.coordination.config.CoordinationProperties;
import com.securityops.coordination.dto.CachedGeofenceRecord;
import com.securityops.coordination.dto.GeofenceShape;
import com.securityops.coordination.entity.SiteGeofence;
import com.securityops.coordination.repository.SiteGeofenceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GeofenceCacheServiceTest {

    private static final GeometryFactory FACTORY = new GeometryFactory(new PrecisionModel(), 4326);

    @Mock
    private SiteGeofenceRepository repository;

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOps;

    @Mock
    private SetOperations<String, String> setOps;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CoordinationProperties properties = new CoordinationProperties();

    private GeofenceCacheService cacheService;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOps);
        lenient().when(redisTemplate.opsForSet()).thenReturn(setOps);
        cacheService = new GeofenceCacheService(repository, redisTemplate, objectMapper, properties);
    }

    @Test
    void databaseLoadIsCachedLocallyAndInRedis() {
        when(repository.findByIdAndActiveTrue(1L)).thenReturn(Optional.of(circle(1L)));

        Optional<CachedGeofenceRecord> first = cacheService.findGeofence(1L);
        Optional<CachedGeofenceRecord> second = cacheService.findGeofence(1L);

        assertThat(first).isPresent();
        assertThat(second).contains(first.get());
        verify(repository, times(1)).findByIdAndActiveTrue(1L);
        verify(valueOps).set(eq("geofence:1"), anyString(), eq(60L), eq(TimeUnit.MINUTES));

        when(repository.countByActiveTrue()).thenReturn(1L);
        GeofenceCacheService.CacheStats stats = cacheService.getCacheStats();
        assertThat(stats.localHits()).isEqualTo(1);
        assertThat(stats.databaseLoads()).isEqualTo(1);
        assertThat(stats.isCacheHealthy()).isTrue();
        assertThat(stats.cacheHitRate()).isEqualTo(50.0);
    }

    @Test
    void polygonSurvivesTheRedisLevel() {
        when(repository.findByIdAndActiveTrue(2L)).thenReturn(Optional.of(polygon(2L)));
        cacheService.findGeofence(2L);
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq("geofence:2"), json.capture(), anyLong(), eq(TimeUnit.MINUTES));

        // a second instance has an empty local map and finds the entry in Redis
        GeofenceCacheService otherInstance = new GeofenceCacheService(repository, redisTemplate, objectMapper, properties);
        when(valueOps.get("geofence:2")).thenReturn(json.getValue());

        CachedGeofenceRecord record = otherInstance.findGeofence(2L).orElseThrow();

        assertThat(record.shape()).isEqualTo(GeofenceShape.POLYGON);
        assertThat(record.siteId()).isEqualTo("S2");
        assertThat(record.evaluate(41.005, 29.005).inside()).isTrue();
        assertThat(record.evaluate(41.05, 29.005).inside()).isFalse();
        assertThat(otherInstance.getCacheStats().redisHits()).isEqualTo(1);
        verify(repository, times(1)).findByIdAndActiveTrue(2L);
    }

    @Test
    void redisOutageFallsBackToDatabase() {
        when(valueOps.get("geofence:1")).thenThrow(new RedisConnectionFailureException("connection refused"));
        when(repository.findByIdAndActiveTrue(1L)).thenReturn(Optional.of(circle(1L)));

        assertThat(cacheService.findGeofence(1L)).isPresent();
    }

    @Test
    void inactiveOrMissingGeofenceIsEmpty() {
        when(repository.findByIdAndActiveTrue(9L)).thenReturn(Optional.empty());

        assertThat(cacheService.findGeofence(9L)).isEmpty();
        assertThat(cacheService.findGeofence(null)).isEmpty();
    }

    @Test
    void refreshSkipsMalformedAndDropsRetiredGeofences() {
        SiteGeofence malformed = SiteGeofence.builder()
                .id(3L).siteId("S3").name("No radius").shape(GeofenceShape.CIRCLE)
                .centerLatitude(41.0).centerLongitude(29.0).build();
        when(repository.findByActiveTrue())
                .thenReturn(List.of(circle(1L), polygon(2L), malformed))
                .thenReturn(List.of(circle(1L)));

        assertThat(cacheService.refreshAllGeofences()).isEqualTo(2);
        assertThat(cacheService.refreshAllGeofences()).isEqualTo(1);

        when(repository.countByActiveTrue()).thenReturn(1L);
        assertThat(cacheService.getCacheStats().cachedGeofenceCount()).isEqualTo(1);
    }

    @Test
    void invalidateForcesReload() {
        when(repository.findByIdAndActiveTrue(1L)).thenReturn(Optional.of(circle(1L)));
        cacheService.findGeofence(1L);

        cacheService.invalidateGeofence(1L);
        cacheService.findGeofence(1L);

        verify(redisTemplate).delete("geofence:1");
        verify(repository, times(2)).findByIdAndActiveTrue(1L);
    }

    private static SiteGeofence circle(Long id) {
        return SiteGeofence.builder()
                .id(id).siteId("S1").name("Main gate").shape(GeofenceShape.CIRCLE)
                .centerLatitude(41.0).centerLongitude(29.0).radiusMeters(100.0)
                .securityLevel("STANDARD").build();
    }

    private static SiteGeofence polygon(Long id) {
        Polygon square = FACTORY.createPolygon(new Coordinate[]{
                new Coordinate(29.0, 41.0),
                new Coordinate(29.01, 41.0),
                new Coordinate(29.01, 41.01),
                new Coordinate(29.0, 41.01),
                new Coordinate(29.0, 41.0)
        });
        return SiteGeofence.builder()
                .id(id).siteId("S2").name("Warehouse").shape(GeofenceShape.POLYGON)
                .boundary(square).securityLevel("RESTRICTED").build();
    }
}
