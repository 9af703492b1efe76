package com.vineroute.hoscompliance.config;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Every jurisdiction-specific threshold in one place.
 *
 * Built from application.properties by {@link ComplianceConfig}; tests
 * construct it directly with synthetic values.
 */
@Value
@Builder(toBuilder = true)
public class ComplianceRules {

    @Builder.Default
    BigDecimal maxDrivingHoursPerDay = BigDecimal.valueOf(10);

    @Builder.Default
    BigDecimal maxOnDutyHoursPerDay = BigDecimal.valueOf(15);

    @Builder.Default
    BigDecimal minOffDutyHoursBetweenShifts = BigDecimal.valueOf(8);

    @Builder.Default
    WeeklyLimit weeklyLimit = WeeklyLimit.SIXTY_HOURS_SEVEN_DAYS;

    /** Exemption radius in air (nautical) miles, measured from the carrier base */
    @Builder.Default
    double radiusAirMiles = 150.0;

    /** Exceedance days allowed inside the window before detailed logs are required */
    @Builder.Default
    int maxExceedanceDays = 8;

    @Builder.Default
    int exemptionWindowDays = 30;

    /** Usage percentage at which a dashboard WARNING is raised (CRITICAL is always 100) */
    @Builder.Default
    BigDecimal warningThresholdPercent = BigDecimal.valueOf(80);

    public static ComplianceRules defaults() {
        return ComplianceRules.builder().build();
    }

    public BigDecimal getWeeklyLimitHours() {
        return BigDecimal.valueOf(weeklyLimit.getHours());
    }

    public int getWeeklyWindowDays() {
        return weeklyLimit.getDays();
    }
}
