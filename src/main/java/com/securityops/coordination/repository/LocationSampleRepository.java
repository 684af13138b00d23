package com.securityops.coordination.repository;

import com.securityops.coordination.entity.LocationSampleEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface LocationSampleRepository extends JpaRepository<LocationSampleEntity, Long> {

    /**
     * Track of an agent over a time range, oldest first.
     * Use case: replaying a patrol route after an incident
     */
    List<LocationSampleEntity> findByAgentIdAndCapturedAtBetweenOrderByCapturedAtAsc(
        String agentId,
        Instant from,
        Instant to
    );

    long countByAgentIdAndCapturedAtAfter(String agentId, Instant since);

    /**
     * Removes samples older than the retention cutoff.
     */
    @Modifying
    @Query("DELETE FROM LocationSampleEntity s WHERE s.capturedAt < :cutoff")
    int deleteCapturedBefore(@Param("cutoff") Instant cutoff);
}
