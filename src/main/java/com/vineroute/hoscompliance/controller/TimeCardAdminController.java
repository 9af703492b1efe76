package com.vineroute.hoscompliance.controller;

import com.vineroute.hoscompliance.dto.ApiResponse;
import com.vineroute.hoscompliance.dto.HistoricalTimeCardRequest;
import com.vineroute.hoscompliance.dto.TimeCardCorrectionRequest;
import com.vineroute.hoscompliance.entity.TimeCard;
import com.vineroute.hoscompliance.model.ClockOutResult;
import com.vineroute.hoscompliance.service.RosterService;
import com.vineroute.hoscompliance.service.TimeCardLedger;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * Office-side time card maintenance.
 *
 * Endpoints:
 *  POST /api/admin/time-cards/{id}/corrections   - supersede a card with corrected times
 *  POST /api/admin/time-cards/historical         - back-fill a paper time card
 *  GET  /api/admin/time-cards?driverId=&from=&to=: history, superseded cards included
 *  POST /api/admin/roster/cache/evict            - after roster edits made outside this service
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class TimeCardAdminController {

    private final TimeCardLedger timeCardLedger;
    private final RosterService rosterService;

    @PostMapping("/time-cards/{timeCardId}/corrections")
    public ResponseEntity<ApiResponse> correct(@PathVariable Long timeCardId,
                                               @Valid @RequestBody TimeCardCorrectionRequest request) {
        log.info("ADMIN: correction of time card #{} — {}", timeCardId, request.getReason());
        ClockOutResult result = timeCardLedger.correctTimeCard(timeCardId, request);
        return ResponseEntity.ok(ApiResponse.success(result,
                "Time card #" + timeCardId + " superseded by #" + result.getTimeCard().getId()));
    }

    @PostMapping("/time-cards/historical")
    public ResponseEntity<ApiResponse> historical(@Valid @RequestBody HistoricalTimeCardRequest request) {
        log.info("ADMIN: historical time card for driver #{}", request.getDriverId());
        ClockOutResult result = timeCardLedger.recordHistoricalTimeCard(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(result,
                "Historical time card #" + result.getTimeCard().getId() + " recorded"));
    }

    @GetMapping("/time-cards")
    public ResponseEntity<ApiResponse> history(
            @RequestParam Long driverId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        if (from.isAfter(to)) {
            return ResponseEntity.badRequest().body(ApiResponse.error("InvalidRange",
                    "'from' must not be after 'to'. Received: from=" + from + ", to=" + to));
        }
        List<TimeCard> cards = timeCardLedger.getTimeCards(driverId, from, to);
        return ResponseEntity.ok(ApiResponse.success(cards, "Found " + cards.size() + " time card(s)"));
    }

    @PostMapping("/roster/cache/evict")
    public ResponseEntity<ApiResponse> evictRosterCache() {
        rosterService.evictRosterCaches();
        return ResponseEntity.ok(ApiResponse.success("Roster caches cleared"));
    }
}
