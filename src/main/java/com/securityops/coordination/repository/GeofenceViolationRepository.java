package com.securityops.coordination.repository;

import com.securityops.coordination.entity.GeofenceViolationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for geofence violations, used by the audit sink and incident reporting.
 */
@Repository
public interface GeofenceViolationRepository extends JpaRepository<GeofenceViolationEntity, Long> {

    boolean existsByViolationId(String violationId);

    List<GeofenceViolationEntity> findByAgentIdOrderByTimestampDesc(String agentId);

    /**
     * Counts violations for an agent in a time period.
     * Use case: "How many times did agent X leave the site during this shift?"
     */
    @Query("""
        SELECT COUNT(v) FROM GeofenceViolationEntity v
        WHERE v.agentId = :agentId
        AND v.timestamp BETWEEN :startTime AND :endTime
        """)
    long countViolationsByAgentInTimeRange(
        @Param("agentId") String agentId,
        @Param("startTime") Instant startTime,
        @Param("endTime") Instant endTime
    );
}
