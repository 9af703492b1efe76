package com.vineroute.hoscompliance.model;

import com.vineroute.hoscompliance.entity.DailyTrip;
import com.vineroute.hoscompliance.entity.TimeCard;
import com.vineroute.hoscompliance.entity.WeeklyHos;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of closing a duty period (clock-out, correction or historical entry).
 * violations may be non-empty: findings never fail the operation.
 */
@Value
@Builder
public class ClockOutResult {

    TimeCard timeCard;
    BigDecimal hoursWorked;
    List<ComplianceViolation> violations;
    DailyTrip dailyTrip;
    WeeklyHos weeklyHos;
    ExemptionStatus exemptionStatus;
}
