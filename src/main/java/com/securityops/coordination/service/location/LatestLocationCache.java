package com.securityops.coordination.service.location;

import com.securityops.coordination.config.CoordinationProperties;
import com.securityops.coordination.dto.LatestLocationView;
import com.securityops.coordination.dto.LocationSample;
import com.securityops.coordination.dto.SampleStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last known position per agent.
 *
 * Last-write-wins by capture timestamp: an older sample never replaces a newer one, even if it
 * arrives later. Entries expire after {@code latest-ttl} without a new sample. Freshness
 * (ACTIVE/STALE) is computed at read time against {@code freshness-window}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LatestLocationCache {

    private final CoordinationProperties properties;
    private final Clock clock;

    private final Map<String, LocationSample> latestByAgent = new ConcurrentHashMap<>();

    /**
     * @return true if the sample became the agent's latest position
     */
    public boolean update(LocationSample sample) {
        LocationSample stored = latestByAgent.merge(sample.agentId(), sample,
            (current, incoming) -> incoming.capturedAt().isAfter(current.capturedAt()) ? incoming : current);
        return stored == sample;
    }

    public Optional<LatestLocationView> latestFor(String agentId) {
        Instant now = clock.instant();
        return Optional.ofNullable(latestByAgent.get(agentId))
            .filter(sample -> !isExpired(sample, now))
            .map(sample -> toView(sample, now));
    }

    public List<LatestLocationView> latestForSite(String siteId) {
        Instant now = clock.instant();
        return latestByAgent.values().stream()
            .filter(sample -> siteId.equals(sample.siteId()))
            .filter(sample -> !isExpired(sample, now))
            .map(sample -> toView(sample, now))
            .sorted(Comparator.comparing(view -> view.sample().agentId()))
            .toList();
    }

    public List<LatestLocationView> latestAll() {
        Instant now = clock.instant();
        return latestByAgent.values().stream()
            .filter(sample -> !isExpired(sample, now))
            .map(sample -> toView(sample, now))
            .sorted(Comparator.comparing(view -> view.sample().agentId()))
            .toList();
    }

    public int size() {
        return latestByAgent.size();
    }

    @Scheduled(fixedDelayString = "${coordination.location.latest-sweep-interval:PT1M}")
    public int evictExpired() {
        Instant now = clock.instant();
        int before = latestByAgent.size();
        latestByAgent.values().removeIf(sample -> isExpired(sample, now));
        int evicted = before - latestByAgent.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired latest-location entries", evicted);
        }
        return evicted;
    }

    private boolean isExpired(LocationSample sample, Instant now) {
        return sample.capturedAt().plus(properties.getLocation().getLatestTtl()).isBefore(now);
    }

    private LatestLocationView toView(LocationSample sample, Instant now) {
        Duration age = Duration.between(sample.capturedAt(), now);
        SampleStatus status = age.compareTo(properties.getLocation().getFreshnessWindow()) > 0
            ? SampleStatus.STALE
            : SampleStatus.ACTIVE;
        return new LatestLocationView(sample, status, Math.max(0, age.getSeconds()));
    }
}
