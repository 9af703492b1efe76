package com.vineroute.hoscompliance.service;

import com.vineroute.hoscompliance.config.CarrierProfile;
import com.vineroute.hoscompliance.config.ComplianceRules;
import com.vineroute.hoscompliance.entity.DailyTrip;
import com.vineroute.hoscompliance.entity.Driver;
import com.vineroute.hoscompliance.entity.TimeCard;
import com.vineroute.hoscompliance.entity.TimeCardStatus;
import com.vineroute.hoscompliance.entity.WeeklyHos;
import com.vineroute.hoscompliance.exception.DriverNotFoundException;
import com.vineroute.hoscompliance.exception.StorageUnavailableException;
import com.vineroute.hoscompliance.model.*;
import com.vineroute.hoscompliance.repository.TimeCardRepository;
import com.vineroute.hoscompliance.util.DutyHours;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the compliance core: dashboard status, fleet overview,
 * exemption and weekly views, and actual hours for invoicing.
 *
 * Nothing here writes. Figures are live: an OPEN card contributes the time
 * elapsed since clock-in.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class ComplianceStatusService {

    private final TimeCardRepository timeCardRepository;
    private final RosterService rosterService;
    private final DistanceTracker distanceTracker;
    private final HosLimitEvaluator hosLimitEvaluator;
    private final ExemptionTracker exemptionTracker;
    private final ComplianceRules rules;
    private final CarrierProfile carrierProfile;
    private final Clock clock;

    /**
     * Current compliance picture of one driver.
     *
     * @throws DriverNotFoundException unknown driver
     */
    public StatusView todayStatus(Long driverId) {
        Driver driver = rosterService.findDriver(driverId)
                .orElseThrow(() -> new DriverNotFoundException(driverId));

        Instant now = Instant.now(clock);
        Optional<TimeCard> open = timeCardRepository.findByOpenDriverKey(driverId);
        LocalDate date = open.map(TimeCard::getWorkDate)
                .orElseGet(() -> LocalDate.ofInstant(now, carrierProfile.getZoneId()));

        // Step 1: hours from closed cards of the duty date plus the running shift
        List<TimeCard> dayCards = timeCardRepository.findByDriverIdAndWorkDateAndStatusNotOrderByClockInAtAsc(
                driverId, date, TimeCardStatus.SUPERSEDED);
        List<TimeCard> closed = dayCards.stream().filter(c -> c.getStatus() == TimeCardStatus.CLOSED).toList();
        BigDecimal running = open.map(c -> DutyHours.between(c.getClockInAt(), now))
                .orElse(BigDecimal.ZERO);

        BigDecimal onDuty = DutyHours.sum(closed.stream().map(TimeCard::getOnDutyHours).toList()).add(running);
        BigDecimal driving = DutyHours.sum(closed.stream().map(TimeCard::getDrivingHours).toList()).add(running);
        BigDecimal weekly = hosLimitEvaluator.computeWeek(driverId, date).getTotalOnDutyHours().add(running);

        // Step 2: distance and exemption window
        Optional<DailyTrip> trip = distanceTracker.findDay(driverId, date);
        boolean noLocationData = trip.map(distanceTracker::lacksLocationData).orElse(!dayCards.isEmpty());
        ExemptionStatus exemption = exemptionTracker.evaluate(driverId, date);

        // Step 3: usages and alerts
        List<LimitUsage> usages = List.of(
                usage(LimitCategory.DAILY_DRIVING, driving, rules.getMaxDrivingHoursPerDay(), "hours"),
                usage(LimitCategory.DAILY_ON_DUTY, onDuty, rules.getMaxOnDutyHoursPerDay(), "hours"),
                usage(LimitCategory.WEEKLY_ON_DUTY, weekly, rules.getWeeklyLimitHours(), "hours"),
                usage(LimitCategory.EXEMPTION_WINDOW, BigDecimal.valueOf(exemption.getExceedanceDays()),
                        BigDecimal.valueOf(exemption.getMaxExceedanceDays()), "days"));

        List<ComplianceAlert> alerts = new ArrayList<>();
        usages.forEach(u -> usageAlert(u).ifPresent(alerts::add));
        if (exemption.isRequiresDetailedLogs()) {
            alerts.add(ComplianceAlert.builder()
                    .source(ViolationType.DETAILED_LOGS_REQUIRED.name())
                    .severity(Severity.CRITICAL)
                    .message(exemption.getExceedanceDays() + " exceedance days in the last "
                            + rules.getExemptionWindowDays() + " days: detailed logs required")
                    .build());
        }
        if (closed.stream().anyMatch(TimeCard::isInsufficientOffDuty)) {
            alerts.add(ComplianceAlert.builder()
                    .source(ViolationType.INSUFFICIENT_OFF_DUTY.name())
                    .severity(Severity.CRITICAL)
                    .message("Less than " + rules.getMinOffDutyHoursBetweenShifts().toPlainString()
                            + " h off duty before today's first shift")
                    .build());
        }
        if (noLocationData) {
            alerts.add(ComplianceAlert.builder()
                    .source(ViolationType.NO_LOCATION_DATA.name())
                    .severity(Severity.WARNING)
                    .message("No GPS data for " + date + "; distance from base is unverified")
                    .build());
        }
        alerts.sort(Comparator.comparing(ComplianceAlert::getSeverity).reversed());

        Optional<TimeCard> current = open.or(() -> dayCards.isEmpty()
                ? Optional.empty()
                : Optional.of(dayCards.get(dayCards.size() - 1)));

        return StatusView.builder()
                .driverId(driverId)
                .driverName(driver.getName())
                .date(date)
                .asOf(now)
                .clockedIn(open.isPresent())
                .currentTimeCardId(current.map(TimeCard::getId).orElse(null))
                .vehicleId(current.map(TimeCard::getVehicleId).orElse(null))
                .clockInAt(current.map(TimeCard::getClockInAt).orElse(null))
                .clockOutAt(current.map(TimeCard::getClockOutAt).orElse(null))
                .onDutyHoursToday(onDuty)
                .drivingHoursToday(driving)
                .weeklyOnDutyHours(weekly)
                .maxAirMilesToday(trip.map(DailyTrip::getMaxAirMiles).orElse(null))
                .exceededRadiusToday(trip.map(DailyTrip::isExceededRadius).orElse(false))
                .noLocationData(noLocationData)
                .exemption(exemption)
                .usages(usages)
                .alerts(alerts)
                .build();
    }

    /**
     * Status of every active driver, by name.
     */
    public List<StatusView> fleetStatus() {
        List<StatusView> views = rosterService.getActiveDrivers().stream()
                .map(d -> todayStatus(d.getId()))
                .toList();
        log.info("Fleet status: {} active driver(s), {} with critical alerts", views.size(),
                views.stream().filter(v -> v.getCriticalAlertCount() > 0).count());
        return views;
    }

    /**
     * On-duty hours of the CLOSED cards of a date, for invoicing.
     *
     * @return empty when the driver has no closed card on that date
     * @throws StorageUnavailableException storage failure
     */
    public Optional<BigDecimal> syncActualHours(Long driverId, LocalDate date) {
        try {
            List<TimeCard> cards = timeCardRepository.findByDriverIdAndWorkDateAndStatusOrderByClockInAtAsc(
                    driverId, date, TimeCardStatus.CLOSED);
            if (cards.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(DutyHours.sum(cards.stream().map(TimeCard::getOnDutyHours).toList()));
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("actual-hours sync", e);
        }
    }

    public ExemptionStatus exemptionStatus(Long driverId, LocalDate asOf) {
        requireDriver(driverId);
        return exemptionTracker.evaluate(driverId, asOf != null ? asOf : today());
    }

    public WeeklyHos weeklyStatus(Long driverId, LocalDate asOf) {
        requireDriver(driverId);
        return hosLimitEvaluator.computeWeek(driverId, asOf != null ? asOf : today());
    }

    private void requireDriver(Long driverId) {
        rosterService.findDriver(driverId).orElseThrow(() -> new DriverNotFoundException(driverId));
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(carrierProfile.getZoneId()));
    }

    private LimitUsage usage(LimitCategory category, BigDecimal used, BigDecimal limit, String unit) {
        return LimitUsage.builder()
                .category(category)
                .used(used)
                .limit(limit)
                .remaining(DutyHours.remaining(used, limit))
                .percentUsed(DutyHours.percentOf(used, limit))
                .unit(unit)
                .build();
    }

    /**
     * CRITICAL at 100 % and above, WARNING from the configured threshold.
     */
    private Optional<ComplianceAlert> usageAlert(LimitUsage usage) {
        Severity severity;
        if (usage.getPercentUsed().compareTo(BigDecimal.valueOf(100)) >= 0) {
            severity = Severity.CRITICAL;
        } else if (usage.getPercentUsed().compareTo(rules.getWarningThresholdPercent()) >= 0) {
            severity = Severity.WARNING;
        } else {
            return Optional.empty();
        }
        return Optional.of(ComplianceAlert.builder()
                .source(usage.getCategory().name())
                .severity(severity)
                .message(String.format("%s: %s of %s %s used (%s%%)", label(usage.getCategory()),
                        usage.getUsed().toPlainString(), usage.getLimit().toPlainString(),
                        usage.getUnit(), usage.getPercentUsed().toPlainString()))
                .build());
    }

    private static String label(LimitCategory category) {
        switch (category) {
            case DAILY_DRIVING:
                return "Daily driving";
            case DAILY_ON_DUTY:
                return "Daily on-duty";
            case WEEKLY_ON_DUTY:
                return "Weekly on-duty";
            default:
                return "Exemption window";
        }
    }
}
