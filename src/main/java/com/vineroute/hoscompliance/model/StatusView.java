package com.vineroute.hoscompliance.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Read model behind the driver compliance dashboard.
 *
 * Hours include the elapsed time of an OPEN card up to {@code asOf}.
 * {@code date} is the duty date: the open card's work date if the driver is
 * clocked in, otherwise today in the carrier zone.
 */
@Value
@Builder
public class StatusView {

    Long driverId;
    String driverName;
    LocalDate date;
    Instant asOf;

    boolean clockedIn;
    Long currentTimeCardId;
    Long vehicleId;
    Instant clockInAt;
    Instant clockOutAt;

    BigDecimal onDutyHoursToday;
    BigDecimal drivingHoursToday;
    BigDecimal weeklyOnDutyHours;

    Double maxAirMilesToday;
    boolean exceededRadiusToday;
    boolean noLocationData;

    ExemptionStatus exemption;

    List<LimitUsage> usages;

    /** Critical first */
    List<ComplianceAlert> alerts;

    /** Limits reached or exceeded, and detailed-log or rest findings */
    public long getCriticalAlertCount() {
        return alerts.stream().filter(a -> a.getSeverity() == Severity.CRITICAL).count();
    }
}
