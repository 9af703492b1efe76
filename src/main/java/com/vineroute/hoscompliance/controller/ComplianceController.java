package com.vineroute.hoscompliance.controller;

import com.vineroute.hoscompliance.dto.ApiResponse;
import com.vineroute.hoscompliance.entity.WeeklyHos;
import com.vineroute.hoscompliance.model.ExemptionStatus;
import com.vineroute.hoscompliance.model.StatusView;
import com.vineroute.hoscompliance.service.ComplianceStatusService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compliance dashboard and invoicing read API. Dates are ISO yyyy-MM-dd in the carrier zone.
 */
@RestController
@RequestMapping("/api/compliance/drivers")
@RequiredArgsConstructor
@Slf4j
public class ComplianceController {

    private final ComplianceStatusService statusService;

    @GetMapping("/{driverId}/status")
    public ResponseEntity<ApiResponse> todayStatus(@PathVariable Long driverId) {
        StatusView view = statusService.todayStatus(driverId);
        return ResponseEntity.ok(ApiResponse.success(view,
                view.getAlerts().size() + " alert(s) for driver #" + driverId));
    }

    @GetMapping("/status")
    public ResponseEntity<ApiResponse> fleetStatus() {
        List<StatusView> views = statusService.fleetStatus();
        return ResponseEntity.ok(ApiResponse.success(views, views.size() + " active driver(s)"));
    }

    @GetMapping("/{driverId}/exemption")
    public ResponseEntity<ApiResponse> exemption(
            @PathVariable Long driverId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        ExemptionStatus status = statusService.exemptionStatus(driverId, asOf);
        return ResponseEntity.ok(ApiResponse.success(status,
                status.getExceedanceDays() + " of " + status.getMaxExceedanceDays() + " exceedance day(s) used"));
    }

    @GetMapping("/{driverId}/weekly")
    public ResponseEntity<ApiResponse> weekly(
            @PathVariable Long driverId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        WeeklyHos week = statusService.weeklyStatus(driverId, asOf);
        return ResponseEntity.ok(ApiResponse.success(week,
                week.getTotalOnDutyHours().toPlainString() + " of " + week.getLimitHours() + " h"));
    }

    /**
     * Actual hours for invoicing. hours is null when no closed card exists;
     * the caller then keeps its estimate.
     */
    @GetMapping("/{driverId}/actual-hours")
    public ResponseEntity<ApiResponse> actualHours(
            @PathVariable Long driverId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        Optional<BigDecimal> hours = statusService.syncActualHours(driverId, date);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("driverId", driverId);
        data.put("date", date.toString());
        data.put("hours", hours.orElse(null));
        return ResponseEntity.ok(ApiResponse.success(data,
                hours.isPresent() ? "Actual hours available" : "No closed time card for " + date));
    }
}
