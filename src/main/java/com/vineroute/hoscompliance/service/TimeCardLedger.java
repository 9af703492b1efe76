package com.vineroute.hoscompliance.service;

import com.vineroute.hoscompliance.config.CarrierProfile;
import com.vineroute.hoscompliance.dto.ClockInRequest;
import com.vineroute.hoscompliance.dto.ClockOutRequest;
import com.vineroute.hoscompliance.dto.HistoricalTimeCardRequest;
import com.vineroute.hoscompliance.dto.TimeCardCorrectionRequest;
import com.vineroute.hoscompliance.dto.WaypointRequest;
import com.vineroute.hoscompliance.entity.ComplianceEventType;
import com.vineroute.hoscompliance.entity.DailyTrip;
import com.vineroute.hoscompliance.entity.Driver;
import com.vineroute.hoscompliance.entity.TimeCard;
import com.vineroute.hoscompliance.entity.TimeCardStatus;
import com.vineroute.hoscompliance.entity.Vehicle;
import com.vineroute.hoscompliance.entity.WeeklyHos;
import com.vineroute.hoscompliance.exception.*;
import com.vineroute.hoscompliance.model.ClockOutResult;
import com.vineroute.hoscompliance.model.ComplianceViolation;
import com.vineroute.hoscompliance.model.Coordinate;
import com.vineroute.hoscompliance.model.ExemptionStatus;
import com.vineroute.hoscompliance.model.Severity;
import com.vineroute.hoscompliance.model.ViolationType;
import com.vineroute.hoscompliance.repository.TimeCardRepository;
import com.vineroute.hoscompliance.util.DutyHours;
import com.vineroute.hoscompliance.util.GeoDistance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Time-card lifecycle: clock-in, waypoints, clock-out, admin corrections and
 * historical entry.
 *
 * Every operation runs in one transaction. Clock-out, correction and
 * historical entry all end in {@link #settleDay}, which finalizes the day's
 * distance, evaluates the HOS limits and the exemption window, audits the
 * findings and pushes them to the dashboard.
 *
 * The "one OPEN card per driver / per vehicle" rule is enforced by unique
 * constraints on TimeCard.openDriverKey / openVehicleKey. Clock-in row-locks
 * the driver and vehicle before looking for OPEN cards, so competing
 * clock-ins queue up and the later ones see the winner's card. A clock-in
 * that still slips past (roster rows locked elsewhere, another writer) is
 * rejected by the database and mapped to the same errors.
 */
@Service
@Slf4j
public class TimeCardLedger {

    private final TimeCardRepository timeCardRepository;
    private final RosterService rosterService;
    private final DistanceTracker distanceTracker;
    private final HosLimitEvaluator hosLimitEvaluator;
    private final ExemptionTracker exemptionTracker;
    private final ComplianceAuditService auditService;
    private final ComplianceNotificationService notificationService;
    private final CarrierProfile carrierProfile;
    private final TransactionTemplate conflictLookup;

    public TimeCardLedger(TimeCardRepository timeCardRepository,
                          RosterService rosterService,
                          DistanceTracker distanceTracker,
                          HosLimitEvaluator hosLimitEvaluator,
                          ExemptionTracker exemptionTracker,
                          ComplianceAuditService auditService,
                          ComplianceNotificationService notificationService,
                          CarrierProfile carrierProfile,
                          PlatformTransactionManager transactionManager) {
        this.timeCardRepository = timeCardRepository;
        this.rosterService = rosterService;
        this.distanceTracker = distanceTracker;
        this.hosLimitEvaluator = hosLimitEvaluator;
        this.exemptionTracker = exemptionTracker;
        this.auditService = auditService;
        this.notificationService = notificationService;
        this.carrierProfile = carrierProfile;
        this.conflictLookup = new TransactionTemplate(transactionManager);
        this.conflictLookup.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.conflictLookup.setReadOnly(true);
    }

    // ═══════════════════════════════════════════════════════════════════════
    //  CLOCK-IN
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Opens a time card and the day's distance tracking.
     *
     * @throws AlreadyClockedInException the driver already holds an OPEN card
     * @throws VehicleInUseException     another driver holds an OPEN card on the vehicle
     * @throws InvalidCoordinateException the clock-in location is out of range
     */
    @Transactional
    public TimeCard clockIn(ClockInRequest request) {
        Long driverId = request.getDriverId();
        Long vehicleId = request.getVehicleId();
        log.info("Clock-in request — driver #{}, vehicle #{}, at {}", driverId, vehicleId, request.getTimestamp());

        // Step 1: roster checks
        requireActiveDriver(driverId);
        requireActiveVehicle(vehicleId);

        // Step 2: location, if the device had a fix
        Coordinate location = request.location();
        if (location != null) {
            GeoDistance.validate(location);
        }

        // Step 3: serialize with other clock-ins for this driver or vehicle, then check
        rosterService.lockForClockIn(driverId, vehicleId);
        timeCardRepository.findByOpenDriverKey(driverId).ifPresent(open -> {
            throw new AlreadyClockedInException(driverId, "since " + open.getClockInAt());
        });
        timeCardRepository.findByOpenVehicleKey(vehicleId).ifPresent(open -> {
            throw new VehicleInUseException(vehicleId, open.getDriverId());
        });

        // Step 4: insert the OPEN card
        Instant clockInAt = request.getTimestamp();
        LocalDate workDate = workDateOf(clockInAt);
        TimeCard card = insertOpenCard(TimeCard.builder()
                .driverId(driverId)
                .vehicleId(vehicleId)
                .workDate(workDate)
                .clockInAt(clockInAt)
                .clockInLatitude(location != null ? location.getLatitude() : null)
                .clockInLongitude(location != null ? location.getLongitude() : null)
                .clockInAccuracy(request.getAccuracy())
                .notes(request.getNotes())
                .status(TimeCardStatus.OPEN)
                .openDriverKey(driverId)
                .openVehicleKey(vehicleId)
                .build());

        // Step 5: distance tracking for the day, seeded with the clock-in location
        distanceTracker.initializeDay(driverId, vehicleId, workDate, location, clockInAt);

        // Step 6: audit
        auditService.record(card, ComplianceEventType.CLOCK_IN, Severity.INFO,
                "Clocked in on vehicle #" + vehicleId, location);

        log.info("Driver #{} clocked in — time card #{}, work date {}", driverId, card.getId(), workDate);
        return card;
    }

    private TimeCard insertOpenCard(TimeCard card) {
        try {
            return timeCardRepository.saveAndFlush(card);
        } catch (DataIntegrityViolationException e) {
            throw resolveOpenCardConflict(e, card.getDriverId(), card.getVehicleId());
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("clock-in", e);
        }
    }

    /**
     * Maps a unique-constraint rejection of an OPEN card to the domain error.
     * The competing card is committed by the time the database reports the
     * conflict, so a fresh read-only transaction can see who holds what.
     */
    private ComplianceException resolveOpenCardConflict(DataIntegrityViolationException e,
                                                        Long driverId, Long vehicleId) {
        log.warn("Concurrent clock-in rejected by the database — driver #{}, vehicle #{}", driverId, vehicleId);

        ComplianceException resolved = conflictLookup.execute(status -> {
            if (timeCardRepository.findByOpenDriverKey(driverId).isPresent()) {
                return new AlreadyClockedInException(driverId);
            }
            return timeCardRepository.findByOpenVehicleKey(vehicleId)
                    .<ComplianceException>map(holder -> new VehicleInUseException(vehicleId, holder.getDriverId()))
                    .orElse(null);
        });
        if (resolved != null) {
            return resolved;
        }

        // the competing card is already gone again: fall back to the constraint name
        String detail = String.valueOf(e.getMostSpecificCause().getMessage()).toLowerCase(Locale.ROOT);
        if (detail.contains("open_driver")) {
            return new AlreadyClockedInException(driverId);
        }
        if (detail.contains("open_vehicle")) {
            return new VehicleInUseException(vehicleId);
        }
        return new StorageUnavailableException("clock-in", e);
    }

    // ═══════════════════════════════════════════════════════════════════════
    //  WAYPOINTS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Attaches a GPS sample to the driver's OPEN card.
     *
     * @return false when the sample was discarded (no OPEN card, or taken before clock-in)
     * @throws InvalidCoordinateException out-of-range coordinate
     */
    @Transactional
    public boolean recordWaypoint(WaypointRequest request) {
        Coordinate point = GeoDistance.validate(request.location());

        Optional<TimeCard> open = timeCardRepository.findByOpenDriverKey(request.getDriverId());
        if (open.isEmpty()) {
            log.debug("Waypoint discarded — driver #{} is not clocked in", request.getDriverId());
            return false;
        }
        TimeCard card = open.get();
        if (request.getTimestamp().isBefore(card.getClockInAt())) {
            log.debug("Waypoint discarded — {} is before clock-in {} of time card #{}",
                    request.getTimestamp(), card.getClockInAt(), card.getId());
            return false;
        }

        DailyTrip trip = distanceTracker.initializeDay(card.getDriverId(), card.getVehicleId(),
                card.getWorkDate(), null, null);
        distanceTracker.appendWaypoint(trip, point, request.getTimestamp());
        return true;
    }

    // ═══════════════════════════════════════════════════════════════════════
    //  CLOCK-OUT
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Closes the driver's OPEN card and runs the end-of-shift evaluations.
     * Violations are returned in the result; they never fail the clock-out.
     *
     * @throws NoOpenTimeCardException        nothing to close (includes a repeated clock-out)
     * @throws ClockOutBeforeClockInException timestamp not after clock-in
     */
    @Transactional
    public ClockOutResult clockOut(ClockOutRequest request) {
        Long driverId = request.getDriverId();
        log.info("Clock-out request — driver #{}, at {}", driverId, request.getTimestamp());

        TimeCard card = timeCardRepository.findOpenByDriverIdForUpdate(driverId)
                .orElseThrow(() -> new NoOpenTimeCardException(driverId));

        Instant clockOutAt = request.getTimestamp();
        if (!clockOutAt.isAfter(card.getClockInAt())) {
            throw new ClockOutBeforeClockInException(card.getClockInAt(), clockOutAt);
        }
        Coordinate location = request.location();
        if (location != null) {
            GeoDistance.validate(location);
        }

        BigDecimal hours = DutyHours.between(card.getClockInAt(), clockOutAt);
        card.setClockOutAt(clockOutAt);
        card.setClockOutLatitude(location != null ? location.getLatitude() : null);
        card.setClockOutLongitude(location != null ? location.getLongitude() : null);
        card.setSignatureRef(request.getSignature());
        card.setOnDutyHours(hours);
        card.setDrivingHours(hours);
        card.setNotes(appendNotes(card.getNotes(), request.getNotes()));
        card.setStatus(TimeCardStatus.CLOSED);
        card.releaseOpenKeys();
        card = timeCardRepository.save(card);

        if (location != null) {
            distanceTracker.initializeDay(driverId, card.getVehicleId(), card.getWorkDate(), location, clockOutAt);
        }

        auditService.record(card, ComplianceEventType.CLOCK_OUT, Severity.INFO,
                "Clocked out after " + hours.toPlainString() + " h", location);
        log.info("Driver #{} clocked out — time card #{}, {} h", driverId, card.getId(), hours);

        return settleDay(card);
    }

    // ═══════════════════════════════════════════════════════════════════════
    //  CORRECTIONS & HISTORICAL ENTRY
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Replaces a card with corrected times. The original is kept as SUPERSEDED
     * (releasing its open keys if it was still OPEN) and the replacement
     * points back to it through supersedesId.
     *
     * Besides the replacement's own date, the daily flags are re-evaluated for
     * the date the card left (when it moved) and for the next work date after
     * each of them, whose off-duty gap depends on the corrected shift.
     */
    @Transactional
    public ClockOutResult correctTimeCard(Long timeCardId, TimeCardCorrectionRequest request) {
        TimeCard original = timeCardRepository.findByIdForUpdate(timeCardId)
                .orElseThrow(() -> new TimeCardNotFoundException(timeCardId));
        if (original.getStatus() == TimeCardStatus.SUPERSEDED) {
            throw new TimeCardAlreadySupersededException(timeCardId);
        }
        if (!request.getClockOutAt().isAfter(request.getClockInAt())) {
            throw new ClockOutBeforeClockInException(request.getClockInAt(), request.getClockOutAt());
        }

        LocalDate originalDate = original.getWorkDate();
        original.setStatus(TimeCardStatus.SUPERSEDED);
        original.releaseOpenKeys();
        timeCardRepository.save(original);

        BigDecimal hours = DutyHours.between(request.getClockInAt(), request.getClockOutAt());
        TimeCard replacement = timeCardRepository.save(TimeCard.builder()
                .driverId(original.getDriverId())
                .vehicleId(original.getVehicleId())
                .workDate(workDateOf(request.getClockInAt()))
                .clockInAt(request.getClockInAt())
                .clockInLatitude(original.getClockInLatitude())
                .clockInLongitude(original.getClockInLongitude())
                .clockInAccuracy(original.getClockInAccuracy())
                .clockOutAt(request.getClockOutAt())
                .clockOutLatitude(original.getClockOutLatitude())
                .clockOutLongitude(original.getClockOutLongitude())
                .signatureRef(original.getSignatureRef())
                .onDutyHours(hours)
                .drivingHours(hours)
                .notes(request.getNotes() != null ? request.getNotes() : original.getNotes())
                .status(TimeCardStatus.CLOSED)
                .supersedesId(original.getId())
                .correctionReason(request.getReason())
                .build());

        String message = String.format("Time card #%d superseded by #%d: %s",
                original.getId(), replacement.getId(), request.getReason());
        auditService.record(original, ComplianceEventType.TIME_CARD_CORRECTED, Severity.INFO, message, null);
        auditService.record(replacement, ComplianceEventType.TIME_CARD_CORRECTED, Severity.INFO, message, null);
        log.info("Time card #{} corrected — replacement #{}, {} h", original.getId(), replacement.getId(), hours);

        // the original date loses the superseded hours, so its rolling totals move too
        if (!originalDate.equals(replacement.getWorkDate())) {
            distanceTracker.finalizeDay(original.getDriverId(), originalDate);
            hosLimitEvaluator.evaluateWeek(original.getDriverId(), originalDate);
            exemptionTracker.recompute(original.getDriverId(), originalDate);
        }

        ClockOutResult result = settleDay(replacement);

        Set<LocalDate> affected = new LinkedHashSet<>();
        affected.add(originalDate);
        nextWorkDate(original.getDriverId(), originalDate).ifPresent(affected::add);
        nextWorkDate(original.getDriverId(), replacement.getWorkDate()).ifPresent(affected::add);
        affected.remove(replacement.getWorkDate());
        affected.forEach(date -> reevaluateDay(original.getDriverId(), date));

        return result;
    }

    private Optional<LocalDate> nextWorkDate(Long driverId, LocalDate after) {
        return timeCardRepository
                .findFirstByDriverIdAndStatusAndWorkDateAfterOrderByWorkDateAsc(driverId, TimeCardStatus.CLOSED, after)
                .map(TimeCard::getWorkDate);
    }

    /**
     * Re-runs the daily limits for the CLOSED cards already on {@code date}
     * and stores the refreshed flags. Findings are audited against the day's
     * last card.
     */
    private void reevaluateDay(Long driverId, LocalDate date) {
        List<TimeCard> cards = timeCardRepository.findByDriverIdAndWorkDateAndStatusOrderByClockInAtAsc(
                driverId, date, TimeCardStatus.CLOSED);
        if (cards.isEmpty()) {
            return;
        }

        List<ComplianceViolation> violations = List.of();
        for (TimeCard card : cards) {
            violations = hosLimitEvaluator.evaluateDay(card);
            timeCardRepository.save(card);
        }
        auditService.recordViolations(cards.get(cards.size() - 1), violations);
        log.info("Daily HOS re-evaluated after correction — driver #{}, date {}, {} card(s), {} violation(s)",
                driverId, date, cards.size(), violations.size());
    }

    /**
     * Records a completed shift after the fact (paper time card). The driver
     * and vehicle must exist but need not be active any more.
     */
    @Transactional
    public ClockOutResult recordHistoricalTimeCard(HistoricalTimeCardRequest request) {
        rosterService.findDriver(request.getDriverId())
                .orElseThrow(() -> new DriverNotFoundException(request.getDriverId()));
        rosterService.findVehicle(request.getVehicleId())
                .orElseThrow(() -> new VehicleNotFoundException(request.getVehicleId()));
        if (!request.getClockOutAt().isAfter(request.getClockInAt())) {
            throw new ClockOutBeforeClockInException(request.getClockInAt(), request.getClockOutAt());
        }
        Coordinate furthest = request.furthestPoint();
        if (furthest != null) {
            GeoDistance.validate(furthest);
        }

        BigDecimal hours = DutyHours.between(request.getClockInAt(), request.getClockOutAt());
        LocalDate workDate = workDateOf(request.getClockInAt());
        TimeCard card = timeCardRepository.save(TimeCard.builder()
                .driverId(request.getDriverId())
                .vehicleId(request.getVehicleId())
                .workDate(workDate)
                .clockInAt(request.getClockInAt())
                .clockOutAt(request.getClockOutAt())
                .onDutyHours(hours)
                .drivingHours(hours)
                .notes(request.getNotes())
                .status(TimeCardStatus.CLOSED)
                .build());

        distanceTracker.initializeDay(card.getDriverId(), card.getVehicleId(), workDate,
                furthest, request.getClockInAt());

        auditService.record(card, ComplianceEventType.HISTORICAL_ENTRY, Severity.INFO,
                "Historical time card for " + workDate + ", " + hours.toPlainString() + " h", furthest);
        log.info("Historical time card #{} recorded — driver #{}, {}", card.getId(), card.getDriverId(), workDate);

        return settleDay(card);
    }

    /**
     * Time cards of a driver whose work date is in [from, to], SUPERSEDED included, in clock-in order.
     */
    @Transactional(readOnly = true)
    public List<TimeCard> getTimeCards(Long driverId, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from (" + from + ") must not be after to (" + to + ")");
        }
        return timeCardRepository.findByDriverIdAndWorkDateBetweenOrderByClockInAtAsc(driverId, from, to);
    }

    // ═══════════════════════════════════════════════════════════════════════
    //  END-OF-DAY EVALUATION
    // ═══════════════════════════════════════════════════════════════════════

    private ClockOutResult settleDay(TimeCard card) {
        Long driverId = card.getDriverId();
        LocalDate date = card.getWorkDate();
        List<ComplianceViolation> violations = new ArrayList<>();

        DailyTrip trip = distanceTracker.finalizeDay(driverId, date);
        if (trip.isNoLocationData()) {
            violations.add(ComplianceViolation.builder()
                    .type(ViolationType.NO_LOCATION_DATA)
                    .severity(Severity.WARNING)
                    .date(date)
                    .message("No GPS location recorded on " + date
                            + "; the air-mile radius could not be verified")
                    .build());
        }

        violations.addAll(hosLimitEvaluator.evaluateDay(card));
        TimeCard saved = timeCardRepository.save(card);

        WeeklyHos week = hosLimitEvaluator.evaluateWeek(driverId, date);
        hosLimitEvaluator.weeklyViolation(week).ifPresent(violations::add);

        ExemptionStatus exemption = exemptionTracker.recompute(driverId, date);
        exemptionTracker.flipViolation(exemption).ifPresent(violations::add);

        auditService.recordViolations(saved, violations);
        notificationService.publishAfterCommit(driverId, saved.getId(), violations);

        return ClockOutResult.builder()
                .timeCard(saved)
                .hoursWorked(saved.getOnDutyHours())
                .violations(violations)
                .dailyTrip(trip)
                .weeklyHos(week)
                .exemptionStatus(exemption)
                .build();
    }

    // ═══════════════════════════════════════════════════════════════════════
    //  HELPERS
    // ═══════════════════════════════════════════════════════════════════════

    private Driver requireActiveDriver(Long driverId) {
        Driver driver = rosterService.findDriver(driverId)
                .orElseThrow(() -> new DriverNotFoundException(driverId));
        if (!driver.isActive()) {
            throw new DriverInactiveException(driverId);
        }
        return driver;
    }

    private Vehicle requireActiveVehicle(Long vehicleId) {
        Vehicle vehicle = rosterService.findVehicle(vehicleId)
                .orElseThrow(() -> new VehicleNotFoundException(vehicleId));
        if (!vehicle.isActive()) {
            throw new VehicleInactiveException(vehicleId);
        }
        return vehicle;
    }

    /** Calendar date of an instant in the carrier's time zone */
    public LocalDate workDateOf(Instant instant) {
        return LocalDate.ofInstant(instant, carrierProfile.getZoneId());
    }

    private static String appendNotes(String existing, String added) {
        if (added == null || added.isBlank()) {
            return existing;
        }
        if (existing == null || existing.isBlank()) {
            return added;
        }
        String joined = existing + "\n" + added;
        return joined.length() > 2000 ? joined.substring(0, 2000) : joined;
    }
}
