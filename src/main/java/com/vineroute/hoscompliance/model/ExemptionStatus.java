package com.vineroute.hoscompliance.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Result of one pass over the rolling exemption window [windowStart, windowEnd].
 */
@Value
@Builder(toBuilder = true)
public class ExemptionStatus {

    Long driverId;
    LocalDate windowStart;
    LocalDate windowEnd;
    int exceedanceDays;
    int maxExceedanceDays;
    List<LocalDate> exceedanceDates;
    boolean requiresDetailedLogs;

    /** Flag value before this recomputation; equals requiresDetailedLogs for read-only evaluations */
    boolean previouslyRequiredDetailedLogs;

    /** Exceedance days that can still be used before detailed logs are required */
    public int getDaysRemaining() {
        return Math.max(0, maxExceedanceDays - exceedanceDays);
    }

    public boolean isFlipped() {
        return requiresDetailedLogs != previouslyRequiredDetailedLogs;
    }
}
