package com.vineroute.hoscompliance.service;

import com.vineroute.hoscompliance.config.CarrierProfile;
import com.vineroute.hoscompliance.config.ComplianceRules;
import com.vineroute.hoscompliance.entity.*;
import com.vineroute.hoscompliance.exception.DriverNotFoundException;
import com.vineroute.hoscompliance.model.*;
import com.vineroute.hoscompliance.repository.TimeCardRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ComplianceStatusService — dashboard read model and invoicing sync.
 */
@ExtendWith(MockitoExtension.class)
class ComplianceStatusServiceTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private TimeCardRepository timeCardRepository;
    @Mock private RosterService      rosterService;
    @Mock private DistanceTracker    distanceTracker;
    @Mock private HosLimitEvaluator  hosLimitEvaluator;
    @Mock private ExemptionTracker   exemptionTracker;

    private ComplianceStatusService statusService;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final Long DRIVER_ID = 4L;
    private static final LocalDate DAY  = LocalDate.of(2026, 6, 10);

    /** 16:30 PDT */
    private static final Instant NOW = Instant.parse("2026-06-10T23:30:00Z");

    @BeforeEach
    void setUp() {
        CarrierProfile profile = CarrierProfile.builder()
                .baseName("Walla Walla Travel Office")
                .baseCoordinate(Coordinate.of(46.0645, -118.3430))
                .zoneId(ZoneId.of("America/Los_Angeles"))
                .build();
        statusService = new ComplianceStatusService(timeCardRepository, rosterService, distanceTracker,
                hosLimitEvaluator, exemptionTracker, ComplianceRules.defaults(), profile,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ── Helper builders ───────────────────────────────────────────────────────

    private void givenDriver() {
        when(rosterService.findDriver(DRIVER_ID)).thenReturn(Optional.of(
                Driver.builder().id(DRIVER_ID).name("Janine Bergevin").active(true).build()));
    }

    private TimeCard card(TimeCardStatus status, String clockIn, String clockOut, String hours) {
        return TimeCard.builder()
                .id(clockIn.hashCode() & 0xffffL)
                .driverId(DRIVER_ID)
                .vehicleId(1L)
                .workDate(DAY)
                .clockInAt(Instant.parse(clockIn))
                .clockOutAt(clockOut != null ? Instant.parse(clockOut) : null)
                .onDutyHours(hours != null ? new BigDecimal(hours) : null)
                .drivingHours(hours != null ? new BigDecimal(hours) : null)
                .status(status)
                .build();
    }

    private void givenWeeklyClosedHours(String hours) {
        when(hosLimitEvaluator.computeWeek(DRIVER_ID, DAY)).thenReturn(WeeklyHos.builder()
                .driverId(DRIVER_ID).windowEnd(DAY).totalOnDutyHours(new BigDecimal(hours)).limitHours(60).build());
    }

    private void givenExemption(int days) {
        when(exemptionTracker.evaluate(DRIVER_ID, DAY)).thenReturn(ExemptionStatus.builder()
                .driverId(DRIVER_ID).windowStart(DAY.minusDays(29)).windowEnd(DAY)
                .exceedanceDays(days).maxExceedanceDays(8).exceedanceDates(List.of())
                .requiresDetailedLogs(days > 8).previouslyRequiredDetailedLogs(days > 8)
                .build());
    }

    private void givenTrip(double maxAirMiles, boolean lacksLocation) {
        DailyTrip trip = DailyTrip.builder().id(8L).driverId(DRIVER_ID).tripDate(DAY)
                .maxAirMiles(maxAirMiles).exceededRadius(maxAirMiles > 150).build();
        when(distanceTracker.findDay(DRIVER_ID, DAY)).thenReturn(Optional.of(trip));
        when(distanceTracker.lacksLocationData(trip)).thenReturn(lacksLocation);
    }

    private static LimitUsage usage(StatusView view, LimitCategory category) {
        return view.getUsages().stream().filter(u -> u.getCategory() == category).findFirst().orElseThrow();
    }

    // ════════════════════════════════════════════════════════════════════════
    // TodayStatus
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Open card since 08:00 counts 8.5 live hours → 85 % of daily driving, WARNING")
    void openCard_liveHours() {
        givenDriver();
        TimeCard open = card(TimeCardStatus.OPEN, "2026-06-10T15:00:00Z", null, null);
        when(timeCardRepository.findByOpenDriverKey(DRIVER_ID)).thenReturn(Optional.of(open));
        when(timeCardRepository.findByDriverIdAndWorkDateAndStatusNotOrderByClockInAtAsc(
                DRIVER_ID, DAY, TimeCardStatus.SUPERSEDED)).thenReturn(List.of(open));
        givenWeeklyClosedHours("20.00");
        givenTrip(42.5, false);
        givenExemption(2);

        StatusView view = statusService.todayStatus(DRIVER_ID);

        assertThat(view.isClockedIn()).isTrue();
        assertThat(view.getCurrentTimeCardId()).isEqualTo(open.getId());
        assertThat(view.getOnDutyHoursToday()).isEqualByComparingTo("8.50");
        assertThat(view.getWeeklyOnDutyHours()).isEqualByComparingTo("28.50");
        assertThat(view.getMaxAirMilesToday()).isEqualTo(42.5);

        LimitUsage driving = usage(view, LimitCategory.DAILY_DRIVING);
        assertThat(driving.getPercentUsed()).isEqualByComparingTo("85.0");
        assertThat(driving.getRemaining()).isEqualByComparingTo("1.50");

        assertThat(view.getAlerts()).extracting(ComplianceAlert::getSource)
                .containsExactly(LimitCategory.DAILY_DRIVING.name());
        assertThat(view.getAlerts().get(0).getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(view.getCriticalAlertCount()).isZero();
    }

    @Test
    @DisplayName("10.5 h closed today → CRITICAL driving alert sorted before warnings")
    void closedCards_overLimit_sortedBySeverity() {
        givenDriver();
        TimeCard morning = card(TimeCardStatus.CLOSED, "2026-06-10T13:00:00Z", "2026-06-10T19:00:00Z", "6.00");
        TimeCard evening = card(TimeCardStatus.CLOSED, "2026-06-10T20:00:00Z", "2026-06-11T00:30:00Z", "4.50");
        when(timeCardRepository.findByDriverIdAndWorkDateAndStatusNotOrderByClockInAtAsc(
                DRIVER_ID, DAY, TimeCardStatus.SUPERSEDED)).thenReturn(List.of(morning, evening));
        givenWeeklyClosedHours("30.00");
        givenTrip(12.0, true);
        givenExemption(1);

        StatusView view = statusService.todayStatus(DRIVER_ID);

        assertThat(view.isClockedIn()).isFalse();
        assertThat(view.getCurrentTimeCardId()).isEqualTo(evening.getId());
        assertThat(view.getDrivingHoursToday()).isEqualByComparingTo("10.50");
        assertThat(view.isNoLocationData()).isTrue();

        assertThat(view.getAlerts()).extracting(ComplianceAlert::getSeverity)
                .containsExactly(Severity.CRITICAL, Severity.WARNING);
        assertThat(view.getAlerts()).extracting(ComplianceAlert::getSource)
                .containsExactly(LimitCategory.DAILY_DRIVING.name(), ViolationType.NO_LOCATION_DATA.name());
    }

    @Test
    @DisplayName("9 exceedance days → DETAILED_LOGS_REQUIRED and 100 %+ exemption usage, both critical")
    void exemptionLost_critical() {
        givenDriver();
        givenWeeklyClosedHours("0.00");
        givenExemption(9);

        StatusView view = statusService.todayStatus(DRIVER_ID);

        assertThat(view.getExemption().isRequiresDetailedLogs()).isTrue();
        assertThat(usage(view, LimitCategory.EXEMPTION_WINDOW).getPercentUsed()).isEqualByComparingTo("112.5");
        assertThat(view.getAlerts()).extracting(ComplianceAlert::getSource)
                .contains(ViolationType.DETAILED_LOGS_REQUIRED.name(), LimitCategory.EXEMPTION_WINDOW.name());
        assertThat(view.getAlerts()).allMatch(a -> a.getSeverity() == Severity.CRITICAL);
        // nothing worked today → no location caveat
        assertThat(view.isNoLocationData()).isFalse();
    }

    @Test
    @DisplayName("Unknown driver → DriverNotFound")
    void unknownDriver() {
        when(rosterService.findDriver(DRIVER_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> statusService.todayStatus(DRIVER_ID)).isInstanceOf(DriverNotFoundException.class);
    }

    @Test
    @DisplayName("Fleet status covers every active driver")
    void fleetStatus() {
        Driver driver = Driver.builder().id(DRIVER_ID).name("Janine Bergevin").active(true).build();
        when(rosterService.getActiveDrivers()).thenReturn(List.of(driver));
        when(rosterService.findDriver(DRIVER_ID)).thenReturn(Optional.of(driver));
        givenWeeklyClosedHours("0.00");
        givenExemption(0);

        assertThat(statusService.fleetStatus()).extracting(StatusView::getDriverName)
                .containsExactly("Janine Bergevin");
    }

    // ════════════════════════════════════════════════════════════════════════
    // SyncActualHours
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Actual hours = sum of the CLOSED cards of the date")
    void syncActualHours_sum() {
        when(timeCardRepository.findByDriverIdAndWorkDateAndStatusOrderByClockInAtAsc(DRIVER_ID, DAY, TimeCardStatus.CLOSED))
                .thenReturn(List.of(
                        card(TimeCardStatus.CLOSED, "2026-06-10T15:00:00Z", "2026-06-10T19:00:00Z", "4.00"),
                        card(TimeCardStatus.CLOSED, "2026-06-10T20:00:00Z", "2026-06-11T00:30:00Z", "4.50")));

        assertThat(statusService.syncActualHours(DRIVER_ID, DAY)).hasValueSatisfying(
                h -> assertThat(h).isEqualByComparingTo("8.50"));
    }

    @Test
    @DisplayName("No closed card → empty, the caller keeps its estimate")
    void syncActualHours_none() {
        assertThat(statusService.syncActualHours(DRIVER_ID, DAY)).isEmpty();
    }
}
