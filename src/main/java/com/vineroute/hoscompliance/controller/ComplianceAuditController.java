package com.vineroute.hoscompliance.controller;

import com.vineroute.hoscompliance.dto.ApiResponse;
import com.vineroute.hoscompliance.entity.ComplianceEvent;
import com.vineroute.hoscompliance.service.ComplianceAuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compliance audit trail, for inspections and payroll disputes.
 *
 * Endpoints:
 *  GET /api/audit/time-card/{timeCardId}   - chronological trail of one card
 *  GET /api/audit/driver/{driverId}        - all events of a driver, newest first
 *  GET /api/audit/events?from=...&to=...   - time-range query (ISO-8601 instants)
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
@Slf4j
public class ComplianceAuditController {

    private final ComplianceAuditService auditService;

    @GetMapping("/time-card/{timeCardId}")
    public ResponseEntity<ApiResponse> getEventsByTimeCard(@PathVariable Long timeCardId) {
        log.info("AUDIT API: GET events for time card #{}", timeCardId);
        List<ComplianceEvent> events = auditService.getEventsByTimeCard(timeCardId);
        return ResponseEntity.ok(ApiResponse.success(toResponseList(events),
                "Found " + events.size() + " audit event(s) for time card #" + timeCardId));
    }

    @GetMapping("/driver/{driverId}")
    public ResponseEntity<ApiResponse> getEventsByDriver(@PathVariable Long driverId) {
        log.info("AUDIT API: GET events for driver #{}", driverId);
        List<ComplianceEvent> events = auditService.getEventsByDriver(driverId);
        return ResponseEntity.ok(ApiResponse.success(toResponseList(events),
                "Found " + events.size() + " audit event(s) for driver #" + driverId));
    }

    @GetMapping("/events")
    public ResponseEntity<ApiResponse> getEventsByTimeRange(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        log.info("AUDIT API: GET events from {} to {}", from, to);

        if (from.isAfter(to)) {
            return ResponseEntity.badRequest().body(ApiResponse.error("InvalidRange",
                    "'from' must not be after 'to'. Received: from=" + from + ", to=" + to));
        }

        List<ComplianceEvent> events = auditService.getEventsByTimeRange(from, to);
        return ResponseEntity.ok(ApiResponse.success(toResponseList(events),
                "Found " + events.size() + " audit event(s) between " + from + " and " + to));
    }

    /**
     * eventTimestamp is when the event was evaluated, createdAt when the row was written.
     */
    private List<Map<String, Object>> toResponseList(List<ComplianceEvent> events) {
        return events.stream().map(e -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id",             e.getId());
            m.put("driverId",       e.getDriverId());
            m.put("vehicleId",      e.getVehicleId());
            m.put("timeCardId",     e.getTimeCardId());
            m.put("eventType",      e.getEventType().name());
            m.put("severity",       e.getSeverity() != null ? e.getSeverity().name() : null);
            m.put("message",        e.getMessage());
            m.put("latitude",       e.getLatitude());
            m.put("longitude",      e.getLongitude());
            m.put("eventTimestamp", e.getTimestamp() != null ? e.getTimestamp().toString() : null);
            m.put("createdAt",      e.getCreatedAt() != null ? e.getCreatedAt().toString() : null);
            return m;
        }).toList();
    }
}
