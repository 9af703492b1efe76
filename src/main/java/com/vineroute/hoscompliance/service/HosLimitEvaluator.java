package com.vineroute.hoscompliance.service;

import com.vineroute.hoscompliance.config.ComplianceRules;
import com.vineroute.hoscompliance.entity.TimeCard;
import com.vineroute.hoscompliance.entity.TimeCardStatus;
import com.vineroute.hoscompliance.entity.WeeklyHos;
import com.vineroute.hoscompliance.model.ComplianceViolation;
import com.vineroute.hoscompliance.model.Severity;
import com.vineroute.hoscompliance.model.ViolationType;
import com.vineroute.hoscompliance.repository.TimeCardRepository;
import com.vineroute.hoscompliance.repository.WeeklyHosRepository;
import com.vineroute.hoscompliance.util.DutyHours;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Hours-of-service limits: daily driving, daily on-duty, off-duty gap between
 * shifts, and the rolling 60h/7-day or 70h/8-day total.
 *
 * Only CLOSED cards count. A limit is violated when the total is strictly
 * greater than the limit; exactly at the limit is compliant.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HosLimitEvaluator {

    private final TimeCardRepository timeCardRepository;
    private final WeeklyHosRepository weeklyHosRepository;
    private final ComplianceRules rules;
    private final Clock clock;

    /**
     * Evaluates the daily limits for the card's work date, summing every CLOSED
     * card of that date (split shifts included), and sets the card's flags.
     * The caller persists the card.
     */
    public List<ComplianceViolation> evaluateDay(TimeCard card) {
        LocalDate date = card.getWorkDate();
        List<TimeCard> dayCards = closedCardsOn(card.getDriverId(), date, card);

        BigDecimal onDuty = DutyHours.sum(dayCards.stream().map(TimeCard::getOnDutyHours).toList());
        BigDecimal driving = DutyHours.sum(dayCards.stream().map(TimeCard::getDrivingHours).toList());

        List<ComplianceViolation> violations = new ArrayList<>();

        boolean drivingExceeded = driving.compareTo(rules.getMaxDrivingHoursPerDay()) > 0;
        if (drivingExceeded) {
            violations.add(ComplianceViolation.builder()
                    .type(ViolationType.DRIVING_LIMIT_EXCEEDED)
                    .severity(Severity.CRITICAL)
                    .date(date)
                    .observed(driving)
                    .limit(rules.getMaxDrivingHoursPerDay())
                    .message(String.format("Driving time %s h exceeds the %s h daily limit",
                            driving.toPlainString(), rules.getMaxDrivingHoursPerDay().toPlainString()))
                    .build());
        }

        boolean onDutyExceeded = onDuty.compareTo(rules.getMaxOnDutyHoursPerDay()) > 0;
        if (onDutyExceeded) {
            violations.add(ComplianceViolation.builder()
                    .type(ViolationType.ON_DUTY_LIMIT_EXCEEDED)
                    .severity(Severity.CRITICAL)
                    .date(date)
                    .observed(onDuty)
                    .limit(rules.getMaxOnDutyHoursPerDay())
                    .message(String.format("On-duty time %s h exceeds the %s h daily limit",
                            onDuty.toPlainString(), rules.getMaxOnDutyHoursPerDay().toPlainString()))
                    .build());
        }

        Optional<BigDecimal> offDuty = offDutyHoursBefore(card.getDriverId(), date, dayCards);
        boolean insufficientRest = offDuty.isPresent()
                && offDuty.get().compareTo(rules.getMinOffDutyHoursBetweenShifts()) < 0;
        if (insufficientRest) {
            violations.add(ComplianceViolation.builder()
                    .type(ViolationType.INSUFFICIENT_OFF_DUTY)
                    .severity(Severity.CRITICAL)
                    .date(date)
                    .observed(offDuty.get())
                    .limit(rules.getMinOffDutyHoursBetweenShifts())
                    .message(String.format("Only %s h off duty before this shift, %s h required",
                            offDuty.get().toPlainString(), rules.getMinOffDutyHoursBetweenShifts().toPlainString()))
                    .build());
        }

        card.setDrivingLimitExceeded(drivingExceeded);
        card.setOnDutyLimitExceeded(onDutyExceeded);
        card.setInsufficientOffDuty(insufficientRest);

        log.info("Daily HOS for driver #{} on {}: on-duty {} h, driving {} h, {} violation(s)",
                card.getDriverId(), date, onDuty, driving, violations.size());
        return violations;
    }

    /**
     * CLOSED cards of the date; {@code card} is merged in when a pending,
     * not-yet-visible save left it out of the query result.
     */
    private List<TimeCard> closedCardsOn(Long driverId, LocalDate date, TimeCard card) {
        List<TimeCard> cards = new ArrayList<>(timeCardRepository
                .findByDriverIdAndWorkDateAndStatusOrderByClockInAtAsc(driverId, date, TimeCardStatus.CLOSED));
        boolean present = cards.stream().anyMatch(c -> c == card
                || (c.getId() != null && Objects.equals(c.getId(), card.getId())));
        if (!present && card.getStatus() == TimeCardStatus.CLOSED) {
            cards.add(card);
            cards.sort(Comparator.comparing(TimeCard::getClockInAt));
        }
        return cards;
    }

    /**
     * Gap between the last shift of an earlier date and the first clock-in of
     * this date. Empty when the driver has no earlier shift on record.
     */
    private Optional<BigDecimal> offDutyHoursBefore(Long driverId, LocalDate date, List<TimeCard> dayCards) {
        if (dayCards.isEmpty()) {
            return Optional.empty();
        }
        Instant firstClockIn = dayCards.get(0).getClockInAt();
        return timeCardRepository
                .findTopByDriverIdAndStatusAndWorkDateBeforeOrderByClockOutAtDesc(driverId, TimeCardStatus.CLOSED, date)
                .filter(prev -> prev.getClockOutAt() != null)
                .map(prev -> DutyHours.between(prev.getClockOutAt(), firstClockIn));
    }

    /**
     * Totals the rolling window ending at asOf without persisting it.
     */
    @Transactional(readOnly = true)
    public WeeklyHos computeWeek(Long driverId, LocalDate asOf) {
        int days = rules.getWeeklyWindowDays();
        LocalDate windowStart = asOf.minusDays(days - 1L);
        List<TimeCard> cards = timeCardRepository.findByDriverIdAndWorkDateBetweenAndStatusOrderByWorkDateAsc(
                driverId, windowStart, asOf, TimeCardStatus.CLOSED);

        BigDecimal onDuty = DutyHours.sum(cards.stream().map(TimeCard::getOnDutyHours).toList());
        BigDecimal driving = DutyHours.sum(cards.stream().map(TimeCard::getDrivingHours).toList());

        return WeeklyHos.builder()
                .driverId(driverId)
                .windowStart(windowStart)
                .windowEnd(asOf)
                .windowDays(days)
                .totalOnDutyHours(onDuty)
                .totalDrivingHours(driving)
                .limitHours(rules.getWeeklyLimit().getHours())
                .violation(onDuty.compareTo(rules.getWeeklyLimitHours()) > 0)
                .evaluatedAt(Instant.now(clock))
                .build();
    }

    /**
     * Recomputes the rolling window ending at asOf and upserts it, keyed by (driver, windowEnd).
     */
    @Transactional
    public WeeklyHos evaluateWeek(Long driverId, LocalDate asOf) {
        WeeklyHos computed = computeWeek(driverId, asOf);
        WeeklyHos row = weeklyHosRepository.findByDriverIdAndWindowEnd(driverId, asOf)
                .orElseGet(() -> WeeklyHos.builder().driverId(driverId).windowEnd(asOf).build());

        row.setWindowStart(computed.getWindowStart());
        row.setWindowDays(computed.getWindowDays());
        row.setTotalOnDutyHours(computed.getTotalOnDutyHours());
        row.setTotalDrivingHours(computed.getTotalDrivingHours());
        row.setLimitHours(computed.getLimitHours());
        row.setViolation(computed.isViolation());
        row.setEvaluatedAt(computed.getEvaluatedAt());
        WeeklyHos saved = weeklyHosRepository.save(row);

        log.info("Weekly HOS for driver #{} {}..{}: {} of {} h{}", driverId, saved.getWindowStart(), asOf,
                saved.getTotalOnDutyHours(), saved.getLimitHours(), saved.isViolation() ? " — VIOLATION" : "");
        return saved;
    }

    public Optional<ComplianceViolation> weeklyViolation(WeeklyHos week) {
        if (!week.isViolation()) {
            return Optional.empty();
        }
        return Optional.of(ComplianceViolation.builder()
                .type(ViolationType.WEEKLY_LIMIT_EXCEEDED)
                .severity(Severity.CRITICAL)
                .date(week.getWindowEnd())
                .observed(week.getTotalOnDutyHours())
                .limit(BigDecimal.valueOf(week.getLimitHours()))
                .message(String.format("%s h on duty in the %d days ending %s exceeds the %d h limit",
                        week.getTotalOnDutyHours().toPlainString(), week.getWindowDays(),
                        week.getWindowEnd(), week.getLimitHours()))
                .build());
    }
}
