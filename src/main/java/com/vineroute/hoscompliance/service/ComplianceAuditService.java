package com.vineroute.hoscompliance.service;

import com.vineroute.hoscompliance.entity.ComplianceEvent;
import com.vineroute.hoscompliance.entity.ComplianceEventType;
import com.vineroute.hoscompliance.entity.TimeCard;
import com.vineroute.hoscompliance.model.ComplianceViolation;
import com.vineroute.hoscompliance.model.Coordinate;
import com.vineroute.hoscompliance.model.Severity;
import com.vineroute.hoscompliance.model.ViolationType;
import com.vineroute.hoscompliance.repository.ComplianceEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Compliance audit trail: writes one ComplianceEvent per clock event,
 * correction and finding, and serves the /api/audit queries.
 *
 * Writes join the caller's transaction, so an audit row commits if and only
 * if the state change it describes commits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ComplianceAuditService {

    private final ComplianceEventRepository eventRepository;
    private final Clock clock;

    public ComplianceEvent record(TimeCard card, ComplianceEventType type, Severity severity,
                                  String message, Coordinate location) {
        ComplianceEvent event = eventRepository.save(ComplianceEvent.builder()
                .driverId(card.getDriverId())
                .vehicleId(card.getVehicleId())
                .timeCardId(card.getId())
                .eventType(type)
                .severity(severity)
                .message(message)
                .latitude(location != null ? location.getLatitude() : null)
                .longitude(location != null ? location.getLongitude() : null)
                .timestamp(Instant.now(clock))
                .build());
        log.info("AUDIT: {} persisted — driver: {}, time card: {}", type, card.getDriverId(), card.getId());
        return event;
    }

    public void recordViolations(TimeCard card, List<ComplianceViolation> violations) {
        for (ComplianceViolation v : violations) {
            record(card, eventTypeOf(v.getType()), v.getSeverity(), v.getMessage(), null);
        }
    }

    private ComplianceEventType eventTypeOf(ViolationType type) {
        switch (type) {
            case DETAILED_LOGS_REQUIRED:
            case EXEMPTION_RESTORED:
                return ComplianceEventType.EXEMPTION_STATUS_CHANGED;
            case NO_LOCATION_DATA:
                return ComplianceEventType.NO_LOCATION_DATA;
            default:
                return ComplianceEventType.HOS_VIOLATION;
        }
    }

    /**
     * @return chronological trail of a time card (clock-in → findings → clock-out → corrections)
     */
    @Transactional(readOnly = true)
    public List<ComplianceEvent> getEventsByTimeCard(Long timeCardId) {
        List<ComplianceEvent> events = eventRepository.findByTimeCardIdOrderByTimestampAsc(timeCardId);
        log.info("AUDIT: Found {} event(s) for time card #{}", events.size(), timeCardId);
        return events;
    }

    @Transactional(readOnly = true)
    public List<ComplianceEvent> getEventsByDriver(Long driverId) {
        List<ComplianceEvent> events = eventRepository.findByDriverIdOrderByTimestampDesc(driverId);
        log.info("AUDIT: Found {} event(s) for driver #{}", events.size(), driverId);
        return events;
    }

    /**
     * @throws IllegalArgumentException if from is after to
     */
    @Transactional(readOnly = true)
    public List<ComplianceEvent> getEventsByTimeRange(Instant from, Instant to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from (" + from + ") must not be after to (" + to + ")");
        }
        List<ComplianceEvent> events = eventRepository.findByTimestampBetweenOrderByTimestampAsc(from, to);
        log.info("AUDIT: Found {} event(s) between {} and {}", events.size(), from, to);
        return events;
    }
}
