package com.vineroute.hoscompliance.service;

import com.vineroute.hoscompliance.dto.WaypointRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking and buffered waypoint intake.
 *
 * Lives in its own bean so each call to TimeCardLedger.recordWaypoint goes
 * through the transactional proxy and gets its own transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WaypointAsyncService {

    private final TimeCardLedger timeCardLedger;

    /**
     * Single sample; the caller has already answered 202 Accepted.
     */
    @Async("waypointTaskExecutor")
    public CompletableFuture<Boolean> recordAsync(WaypointRequest request) {
        try {
            return CompletableFuture.completedFuture(timeCardLedger.recordWaypoint(request));
        } catch (RuntimeException e) {
            log.error("Async waypoint failed — driver #{}, ts: {} — {}",
                    request.getDriverId(), request.getTimestamp(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Samples buffered on the device while it had no signal.
     *
     * Steps:
     * 1. Sort by timestamp (delivery order is not sample order)
     * 2. Record each in its own transaction
     * 3. A rejected sample is counted and logged; the rest still go through
     */
    public Map<String, Integer> processBatch(List<WaypointRequest> requests) {
        log.info("Waypoint batch started — {} buffered sample(s)", requests.size());

        List<WaypointRequest> sorted = requests.stream()
                .sorted(Comparator.comparing(WaypointRequest::getTimestamp,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();

        int recorded = 0, discarded = 0, failed = 0;
        for (WaypointRequest req : sorted) {
            if (req.getDriverId() == null || req.getTimestamp() == null) {
                log.warn("Batch waypoint skipped — driver #{}, ts: {} — driver and timestamp are required",
                        req.getDriverId(), req.getTimestamp());
                failed++;
                continue;
            }
            try {
                if (timeCardLedger.recordWaypoint(req)) {
                    recorded++;
                } else {
                    discarded++;
                }
            } catch (RuntimeException e) {
                log.error("Batch waypoint failed — driver #{}, ts: {} — {}",
                        req.getDriverId(), req.getTimestamp(), e.getMessage());
                failed++;
            }
        }

        log.info("Waypoint batch complete — total: {}, recorded: {}, discarded: {}, failed: {}",
                requests.size(), recorded, discarded, failed);
        return Map.of("total", requests.size(), "recorded", recorded, "discarded", discarded, "failed", failed);
    }
}
