package com.securityops.coordination.service.location;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.securityops.coordination.config.CoordinationProperties;
import com.securityops.coordination.dto.CachedGeofenceRecord;
import com.securityops.coordination.dto.GeofenceShape;
import com.securityops.coordination.entity.SiteGeofence;
import com.securityops.coordination.repository.SiteGeofenceRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Three-level cache of site geofences used by the ingest hot path.
 *
 * Lookup order:
 * 1. In-process map: no I/O, the common case once warmed
 * 2. Redis: JSON entry per geofence with the polygon as WKT, shared across instances
 * 3. Database: source of truth, read only on a miss in both caches
 *
 * Architecture:
 * - Cache Warming: all active geofences are loaded on startup
 * - Cache Refresh: scheduled, picks up geofences edited in the database
 * - Cache Invalidation: manual, when a single geofence changes
 *
 * Redis being unavailable degrades to database reads; it never fails ingest.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeofenceCacheService {

    private static final String GEOFENCE_KEY_PREFIX = "geofence:";
    private static final String ACTIVE_GEOFENCES_KEY = "geofences:active";

    private final SiteGeofenceRepository geofenceRepository;
    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final CoordinationProperties properties;

    private final Map<Long, CachedGeofenceRecord> localCache = new ConcurrentHashMap<>();
    private final AtomicLong localHits = new AtomicLong();
    private final AtomicLong redisHits = new AtomicLong();
    private final AtomicLong databaseLoads = new AtomicLong();

    private final WKTWriter wktWriter = new WKTWriter();

    /**
     * Cache warming on application startup, so the first samples of the day do not all hit the database.
     */
    @PostConstruct
    public void warmUpCache() {
        log.info("Starting geofence cache warm-up...");
        long startTime = System.currentTimeMillis();
        try {
            int cachedCount = refreshAllGeofences();
            log.info("Geofence cache warm-up completed: {} geofences cached in {}ms",
                cachedCount, System.currentTimeMillis() - startTime);
        } catch (Exception e) {
            // Startup continues; lookups fall back to the database
            log.error("Geofence cache warm-up failed", e);
        }
    }

    @Scheduled(fixedRateString = "${coordination.geofence.cache-refresh-interval-minutes:30}",
               initialDelayString = "${coordination.geofence.cache-refresh-interval-minutes:30}",
               timeUnit = TimeUnit.MINUTES)
    public void scheduledCacheRefresh() {
        log.info("Starting scheduled geofence cache refresh...");
        try {
            int refreshedCount = refreshAllGeofences();
            log.info("Scheduled geofence cache refresh completed: {} geofences refreshed", refreshedCount);
        } catch (Exception e) {
            log.error("Scheduled geofence cache refresh failed", e);
        }
    }

    /**
     * Reloads every active geofence from the database into both cache levels.
     * Geofences that are no longer active are dropped.
     *
     * @return Number of geofences cached
     */
    public int refreshAllGeofences() {
        List<SiteGeofence> activeGeofences = geofenceRepository.findByActiveTrue();
        if (activeGeofences.isEmpty()) {
            log.warn("No active geofences found in database");
        }

        Set<Long> activeIds = new HashSet<>();
        for (SiteGeofence geofence : activeGeofences) {
            if (!geofence.isWellFormed()) {
                log.warn("Geofence {} ({}) is malformed, skipping cache", geofence.getId(), geofence.getShape());
                continue;
            }
            CachedGeofenceRecord record = geofence.toCachedRecord();
            localCache.put(record.geofenceId(), record);
            writeToRedis(record);
            activeIds.add(record.geofenceId());
        }
        localCache.keySet().retainAll(activeIds);

        try {
            stringRedisTemplate.delete(ACTIVE_GEOFENCES_KEY);
            if (!activeIds.isEmpty()) {
                stringRedisTemplate.opsForSet().add(ACTIVE_GEOFENCES_KEY,
                    activeIds.stream().map(String::valueOf).toArray(String[]::new));
                stringRedisTemplate.expire(ACTIVE_GEOFENCES_KEY,
                    properties.getGeofence().getCacheTtl().toMinutes(), TimeUnit.MINUTES);
            }
        } catch (DataAccessException e) {
            log.warn("Redis unavailable while updating active geofence index: {}", e.getMessage());
        }

        log.info("Cached {} geofences", activeIds.size());
        return activeIds.size();
    }

    /**
     * Resolves a geofence by id, walking local map, Redis, then database.
     *
     * @return empty when the geofence does not exist, is inactive or is malformed
     */
    public Optional<CachedGeofenceRecord> findGeofence(Long geofenceId) {
        if (geofenceId == null) {
            return Optional.empty();
        }

        CachedGeofenceRecord local = localCache.get(geofenceId);
        if (local != null) {
            localHits.incrementAndGet();
            return Optional.of(local);
        }

        CachedGeofenceRecord fromRedis = readFromRedis(geofenceId);
        if (fromRedis != null) {
            redisHits.incrementAndGet();
            localCache.put(geofenceId, fromRedis);
            return Optional.of(fromRedis);
        }

        databaseLoads.incrementAndGet();
        log.debug("Geofence {} not cached, loading from database", geofenceId);
        Optional<CachedGeofenceRecord> loaded = geofenceRepository.findByIdAndActiveTrue(geofenceId)
            .filter(SiteGeofence::isWellFormed)
            .map(SiteGeofence::toCachedRecord);
        loaded.ifPresent(record -> {
            localCache.put(geofenceId, record);
            writeToRedis(record);
        });
        return loaded;
    }

    /**
     * Invalidates a geofence in both cache levels. Call this when a geofence is edited.
     */
    public void invalidateGeofence(Long geofenceId) {
        localCache.remove(geofenceId);
        try {
            stringRedisTemplate.delete(GEOFENCE_KEY_PREFIX + geofenceId);
            stringRedisTemplate.opsForSet().remove(ACTIVE_GEOFENCES_KEY, String.valueOf(geofenceId));
        } catch (DataAccessException e) {
            log.warn("Redis unavailable while invalidating geofence {}: {}", geofenceId, e.getMessage());
        }
        log.info("Invalidated cached geofence: {}", geofenceId);
    }

    public void clearCache() {
        Set<Long> ids = new HashSet<>(localCache.keySet());
        ids.forEach(this::invalidateGeofence);
        try {
            stringRedisTemplate.delete(ACTIVE_GEOFENCES_KEY);
        } catch (DataAccessException e) {
            log.warn("Redis unavailable while clearing geofence cache: {}", e.getMessage());
        }
        log.info("Cleared all cached geofences");
    }

    public CacheStats getCacheStats() {
        int databaseCount = (int) geofenceRepository.countByActiveTrue();
        return new CacheStats(localCache.size(), databaseCount,
            localHits.get(), redisHits.get(), databaseLoads.get());
    }

    private void writeToRedis(CachedGeofenceRecord record) {
        try {
            CacheEntry entry = new CacheEntry(
                record.geofenceId(),
                record.siteId(),
                record.name(),
                record.shape(),
                record.centerLatitude(),
                record.centerLongitude(),
                record.radiusMeters(),
                record.boundary() == null ? null : wktWriter.write(record.boundary()),
                record.securityLevel()
            );
            stringRedisTemplate.opsForValue().set(
                GEOFENCE_KEY_PREFIX + record.geofenceId(),
                objectMapper.writeValueAsString(entry),
                properties.getGeofence().getCacheTtl().toMinutes(),
                TimeUnit.MINUTES
            );
            log.debug("Cached geofence in Redis: {}", record.toLogString());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize geofence {}", record.geofenceId(), e);
        } catch (DataAccessException e) {
            log.warn("Redis unavailable, geofence {} kept in process only: {}", record.geofenceId(), e.getMessage());
        }
    }

    private CachedGeofenceRecord readFromRedis(Long geofenceId) {
        try {
            String json = stringRedisTemplate.opsForValue().get(GEOFENCE_KEY_PREFIX + geofenceId);
            if (json == null) {
                return null;
            }
            CacheEntry entry = objectMapper.readValue(json, CacheEntry.class);
            if (entry.shape() == GeofenceShape.POLYGON) {
                // WKTReader is not thread-safe
                Geometry geometry = new WKTReader().read(entry.boundaryWkt());
                return CachedGeofenceRecord.polygon(entry.geofenceId(), entry.siteId(), entry.name(),
                    (Polygon) geometry, entry.securityLevel());
            }
            return CachedGeofenceRecord.circle(entry.geofenceId(), entry.siteId(), entry.name(),
                entry.centerLatitude(), entry.centerLongitude(), entry.radiusMeters(), entry.securityLevel());
        } catch (DataAccessException e) {
            log.warn("Redis unavailable reading geofence {}: {}", geofenceId, e.getMessage());
        } catch (JsonProcessingException | ParseException | ClassCastException e) {
            log.error("Failed to parse cached geofence: {}", geofenceId, e);
        }
        return null;
    }

    /**
     * Redis storage format. Key: "geofence:{id}", value: this record as JSON.
     */
    record CacheEntry(
        Long geofenceId,
        String siteId,
        String name,
        GeofenceShape shape,
        Double centerLatitude,
        Double centerLongitude,
        Double radiusMeters,
        String boundaryWkt,
        String securityLevel
    ) {
    }

    /**
     * Cache statistics for monitoring.
     */
    public record CacheStats(
        int cachedGeofenceCount,
        int databaseGeofenceCount,
        long localHits,
        long redisHits,
        long databaseLoads
    ) {
        public boolean isCacheHealthy() {
            return cachedGeofenceCount == databaseGeofenceCount;
        }

        public double cacheHitRate() {
            long total = localHits + redisHits + databaseLoads;
            if (total == 0) return 0.0;
            return (double) (localHits + redisHits) / total * 100.0;
        }
    }
}
