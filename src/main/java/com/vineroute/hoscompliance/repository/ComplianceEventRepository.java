package com.vineroute.hoscompliance.repository;

import com.vineroute.hoscompliance.entity.ComplianceEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for ComplianceEvent, the audit trail behind /api/audit.
 * Backed by the (driver_id, event_timestamp) and (time_card_id) indexes.
 */
@Repository
public interface ComplianceEventRepository extends JpaRepository<ComplianceEvent, Long> {

    /** Chronological trail of one time card */
    List<ComplianceEvent> findByTimeCardIdOrderByTimestampAsc(Long timeCardId);

    /** Driver history, newest first */
    List<ComplianceEvent> findByDriverIdOrderByTimestampDesc(Long driverId);

    List<ComplianceEvent> findByTimestampBetweenOrderByTimestampAsc(Instant from, Instant to);
}
