package com.securityops.coordination.repository;

import com.securityops.coordination.entity.SiteGeofence;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for site geofences.
 *
 * Point-in-boundary testing happens in memory on cached copies, so no spatial SQL is needed
 * here; the repository only feeds the cache.
 */
@Repository
public interface SiteGeofenceRepository extends JpaRepository<SiteGeofence, Long> {

    /**
     * All active geofences. Used for cache warm-up and scheduled refresh.
     */
    List<SiteGeofence> findByActiveTrue();

    Optional<SiteGeofence> findByIdAndActiveTrue(Long id);

    List<SiteGeofence> findBySiteIdAndActiveTrue(String siteId);

    long countByActiveTrue();
}
