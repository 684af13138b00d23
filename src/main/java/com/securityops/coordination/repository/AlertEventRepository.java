package com.securityops.coordination.repository;

import com.securityops.coordination.entity.AlertEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AlertEventRepository extends JpaRepository<AlertEventEntity, Long> {

    boolean existsByAlertIdAndSequence(String alertId, Long sequence);

    List<AlertEventEntity> findByAlertIdOrderBySequenceAsc(String alertId);
}
