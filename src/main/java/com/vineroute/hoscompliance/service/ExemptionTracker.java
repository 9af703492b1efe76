package com.vineroute.hoscompliance.service;

import com.vineroute.hoscompliance.config.ComplianceRules;
import com.vineroute.hoscompliance.entity.DailyTrip;
import com.vineroute.hoscompliance.entity.MonthlyExemptionStatus;
import com.vineroute.hoscompliance.model.ComplianceViolation;
import com.vineroute.hoscompliance.model.ExemptionStatus;
import com.vineroute.hoscompliance.model.Severity;
import com.vineroute.hoscompliance.model.ViolationType;
import com.vineroute.hoscompliance.repository.DailyTripRepository;
import com.vineroute.hoscompliance.repository.MonthlyExemptionStatusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Rolling 150-air-mile exemption window.
 *
 * The window is the {@code exemptionWindowDays} calendar days ending at asOf,
 * inclusive. Exceedance days are always recounted from daily_trips; the stored
 * MonthlyExemptionStatus row is a snapshot used only to detect when the
 * detailed-logs flag flips.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExemptionTracker {

    private final DailyTripRepository dailyTripRepository;
    private final MonthlyExemptionStatusRepository statusRepository;
    private final ComplianceRules rules;
    private final Clock clock;

    /**
     * Counts exceedance days in the window ending at asOf without persisting anything.
     * previouslyRequiredDetailedLogs mirrors the current value.
     */
    @Transactional(readOnly = true)
    public ExemptionStatus evaluate(Long driverId, LocalDate asOf) {
        LocalDate windowStart = windowStart(asOf);
        List<LocalDate> dates = dailyTripRepository
                .findByDriverIdAndExceededRadiusTrueAndTripDateBetweenOrderByTripDateAsc(driverId, windowStart, asOf)
                .stream()
                .map(DailyTrip::getTripDate)
                .distinct()
                .sorted()
                .toList();

        boolean requires = dates.size() > rules.getMaxExceedanceDays();
        return ExemptionStatus.builder()
                .driverId(driverId)
                .windowStart(windowStart)
                .windowEnd(asOf)
                .exceedanceDays(dates.size())
                .maxExceedanceDays(rules.getMaxExceedanceDays())
                .exceedanceDates(dates)
                .requiresDetailedLogs(requires)
                .previouslyRequiredDetailedLogs(requires)
                .build();
    }

    /**
     * Recounts the window ending at asOf and upserts the snapshot row.
     *
     * The previous flag comes from the stored row for the same window if one
     * exists, else from the latest earlier window, else false.
     */
    @Transactional
    public ExemptionStatus recompute(Long driverId, LocalDate asOf) {
        ExemptionStatus current = evaluate(driverId, asOf);
        LocalDate windowStart = current.getWindowStart();

        Optional<MonthlyExemptionStatus> existing = statusRepository.findByDriverIdAndWindowStart(driverId, windowStart);
        boolean previous = existing
                .or(() -> statusRepository.findTopByDriverIdAndWindowStartBeforeOrderByWindowStartDesc(driverId, windowStart))
                .map(MonthlyExemptionStatus::isRequiresDetailedLogs)
                .orElse(false);

        MonthlyExemptionStatus row = existing.orElseGet(() -> MonthlyExemptionStatus.builder()
                .driverId(driverId)
                .windowStart(windowStart)
                .build());
        row.setWindowEnd(asOf);
        row.setExceedanceDays(current.getExceedanceDays());
        row.setRequiresDetailedLogs(current.isRequiresDetailedLogs());
        row.setEvaluatedAt(Instant.now(clock));
        statusRepository.save(row);

        ExemptionStatus result = current.toBuilder().previouslyRequiredDetailedLogs(previous).build();
        if (result.isFlipped()) {
            log.warn("Exemption status flipped for driver #{} — {} exceedance day(s) in {}..{}, detailed logs required: {}",
                    driverId, result.getExceedanceDays(), windowStart, asOf, result.isRequiresDetailedLogs());
        } else {
            log.info("Exemption window {}..{} for driver #{}: {} of {} exceedance day(s)",
                    windowStart, asOf, driverId, result.getExceedanceDays(), result.getMaxExceedanceDays());
        }
        return result;
    }

    /**
     * DETAILED_LOGS_REQUIRED (critical) when the flag turned on,
     * EXEMPTION_RESTORED (info) when it turned off, nothing otherwise.
     */
    public Optional<ComplianceViolation> flipViolation(ExemptionStatus status) {
        if (!status.isFlipped()) {
            return Optional.empty();
        }
        ComplianceViolation.ComplianceViolationBuilder v = ComplianceViolation.builder()
                .date(status.getWindowEnd())
                .observed(BigDecimal.valueOf(status.getExceedanceDays()))
                .limit(BigDecimal.valueOf(status.getMaxExceedanceDays()));
        if (status.isRequiresDetailedLogs()) {
            return Optional.of(v.type(ViolationType.DETAILED_LOGS_REQUIRED)
                    .severity(Severity.CRITICAL)
                    .message(String.format("Exceeded the %s air-mile radius on %d days in the last %d days (max %d); "
                                    + "full record-of-duty-status logs are now required",
                            formatRadius(), status.getExceedanceDays(), rules.getExemptionWindowDays(),
                            status.getMaxExceedanceDays()))
                    .build());
        }
        return Optional.of(v.type(ViolationType.EXEMPTION_RESTORED)
                .severity(Severity.INFO)
                .message(String.format("Back to %d exceedance day(s) in the last %d days; "
                                + "short-haul time-card exemption applies again",
                        status.getExceedanceDays(), rules.getExemptionWindowDays()))
                .build());
    }

    public LocalDate windowStart(LocalDate asOf) {
        return asOf.minusDays(rules.getExemptionWindowDays() - 1L);
    }

    private String formatRadius() {
        return BigDecimal.valueOf(rules.getRadiusAirMiles()).stripTrailingZeros().toPlainString();
    }
}
