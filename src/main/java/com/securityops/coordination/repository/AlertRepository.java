package com.securityops.coordination.repository;

import com.securityops.coordination.dto.AlertStatus;
import com.securityops.coordination.entity.AlertEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface AlertRepository extends JpaRepository<AlertEntity, String> {

    /**
     * Alerts in the given states. Used on startup to re-arm escalation timers.
     */
    List<AlertEntity> findByStatusIn(Collection<AlertStatus> statuses);
}
