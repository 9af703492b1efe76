package com.vineroute.hoscompliance.controller;

import com.vineroute.hoscompliance.dto.ApiResponse;
import com.vineroute.hoscompliance.dto.ClockInRequest;
import com.vineroute.hoscompliance.dto.ClockOutRequest;
import com.vineroute.hoscompliance.dto.WaypointRequest;
import com.vineroute.hoscompliance.entity.TimeCard;
import com.vineroute.hoscompliance.model.ClockOutResult;
import com.vineroute.hoscompliance.service.TimeCardLedger;
import com.vineroute.hoscompliance.service.WaypointAsyncService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Driver app time clock.
 *
 * Endpoints:
 *  POST /api/time-clock/clock-in
 *  POST /api/time-clock/clock-out
 *  POST /api/time-clock/waypoints          - one GPS sample, processed inline
 *  POST /api/time-clock/waypoints/async    - 202 Accepted, processed on the waypoint pool
 *  POST /api/time-clock/waypoints/batch    - samples buffered while offline
 *
 * Batch elements are validated one by one; a single malformed sample rejects
 * the whole batch with 400 before anything is recorded.
 */
@RestController
@RequestMapping("/api/time-clock")
@Validated
@RequiredArgsConstructor
@Slf4j
public class TimeClockController {

    private final TimeCardLedger timeCardLedger;
    private final WaypointAsyncService waypointAsyncService;

    @Value("${waypoint.batch.max-size:500}")
    private int maxBatchSize;

    @PostMapping("/clock-in")
    public ResponseEntity<ApiResponse> clockIn(@Valid @RequestBody ClockInRequest request) {
        TimeCard card = timeCardLedger.clockIn(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(card, "Clocked in — time card #" + card.getId()));
    }

    /**
     * Violations found at clock-out are part of the successful response, never an error.
     */
    @PostMapping("/clock-out")
    public ResponseEntity<ApiResponse> clockOut(@Valid @RequestBody ClockOutRequest request) {
        ClockOutResult result = timeCardLedger.clockOut(request);
        String message = result.getViolations().isEmpty()
                ? "Clocked out after " + result.getHoursWorked().toPlainString() + " h"
                : "Clocked out after " + result.getHoursWorked().toPlainString() + " h with "
                        + result.getViolations().size() + " compliance finding(s)";
        return ResponseEntity.ok(ApiResponse.success(result, message));
    }

    @PostMapping("/waypoints")
    public ResponseEntity<ApiResponse> recordWaypoint(@Valid @RequestBody WaypointRequest request) {
        boolean recorded = timeCardLedger.recordWaypoint(request);
        return ResponseEntity.ok(ApiResponse.success(Map.of("recorded", recorded),
                recorded ? "Waypoint recorded" : "Waypoint discarded — no open time card covers it"));
    }

    @PostMapping("/waypoints/async")
    public ResponseEntity<ApiResponse> recordWaypointAsync(@Valid @RequestBody WaypointRequest request) {
        log.debug("Async waypoint queued — driver #{}", request.getDriverId());
        waypointAsyncService.recordAsync(request);
        return ResponseEntity.accepted()
                .body(ApiResponse.success("Waypoint accepted for async processing"));
    }

    @PostMapping("/waypoints/batch")
    public ResponseEntity<ApiResponse> recordWaypointBatch(@RequestBody List<@Valid WaypointRequest> requests) {
        if (requests.isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(ApiResponse.error("EmptyBatch", "Batch is empty — nothing to process"));
        }
        if (requests.size() > maxBatchSize) {
            log.warn("Waypoint batch rejected — size {} exceeds max allowed {}", requests.size(), maxBatchSize);
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                    .body(ApiResponse.error("BatchTooLarge", "Batch size " + requests.size()
                            + " exceeds maximum allowed " + maxBatchSize + ". Split into smaller batches."));
        }

        Map<String, Integer> result = waypointAsyncService.processBatch(requests);
        return ResponseEntity.ok(ApiResponse.success(result,
                "Batch processed: " + result.get("recorded") + "/" + result.get("total") + " recorded"));
    }
}
