package com.vineroute.hoscompliance.config;

import com.vineroute.hoscompliance.model.Coordinate;
import com.vineroute.hoscompliance.util.GeoDistance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneId;

/**
 * Assembles the injected regulatory thresholds and carrier reference data.
 */
@Configuration
@Slf4j
public class ComplianceConfig {

    @Value("${compliance.max-driving-hours-per-day:10}")
    private BigDecimal maxDrivingHoursPerDay;

    @Value("${compliance.max-on-duty-hours-per-day:15}")
    private BigDecimal maxOnDutyHoursPerDay;

    @Value("${compliance.min-off-duty-hours-between-shifts:8}")
    private BigDecimal minOffDutyHours;

    @Value("${compliance.weekly-limit:SIXTY_HOURS_SEVEN_DAYS}")
    private WeeklyLimit weeklyLimit;

    @Value("${compliance.radius-air-miles:150}")
    private double radiusAirMiles;

    @Value("${compliance.max-exceedance-days:8}")
    private int maxExceedanceDays;

    @Value("${compliance.exemption-window-days:30}")
    private int exemptionWindowDays;

    @Value("${compliance.warning-threshold-percent:80}")
    private BigDecimal warningThresholdPercent;

    @Value("${carrier.base.name:Carrier Base}")
    private String baseName;

    @Value("${carrier.base.latitude}")
    private double baseLatitude;

    @Value("${carrier.base.longitude}")
    private double baseLongitude;

    @Value("${carrier.zone-id:UTC}")
    private String zoneId;

    @Bean
    public ComplianceRules complianceRules() {
        ComplianceRules rules = ComplianceRules.builder()
                .maxDrivingHoursPerDay(maxDrivingHoursPerDay)
                .maxOnDutyHoursPerDay(maxOnDutyHoursPerDay)
                .minOffDutyHoursBetweenShifts(minOffDutyHours)
                .weeklyLimit(weeklyLimit)
                .radiusAirMiles(radiusAirMiles)
                .maxExceedanceDays(maxExceedanceDays)
                .exemptionWindowDays(exemptionWindowDays)
                .warningThresholdPercent(warningThresholdPercent)
                .build();
        log.info("Compliance rules: driving {}h/day, on-duty {}h/day, off-duty {}h, weekly {}, radius {} nmi, {} days per {}-day window",
                rules.getMaxDrivingHoursPerDay(), rules.getMaxOnDutyHoursPerDay(),
                rules.getMinOffDutyHoursBetweenShifts(), rules.getWeeklyLimit(),
                rules.getRadiusAirMiles(), rules.getMaxExceedanceDays(), rules.getExemptionWindowDays());
        return rules;
    }

    @Bean
    public CarrierProfile carrierProfile() {
        Coordinate base = GeoDistance.validate(Coordinate.of(baseLatitude, baseLongitude));
        CarrierProfile profile = CarrierProfile.builder()
                .baseName(baseName)
                .baseCoordinate(base)
                .zoneId(ZoneId.of(zoneId))
                .build();
        log.info("Carrier base '{}' at {}, zone {}", baseName, base, zoneId);
        return profile;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
