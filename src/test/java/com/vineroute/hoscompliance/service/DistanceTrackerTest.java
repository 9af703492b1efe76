package com.vineroute.hoscompliance.service;

import com.vineroute.hoscompliance.config.CarrierProfile;
import com.vineroute.hoscompliance.config.ComplianceRules;
import com.vineroute.hoscompliance.entity.DailyTrip;
import com.vineroute.hoscompliance.entity.TripWaypoint;
import com.vineroute.hoscompliance.exception.InvalidCoordinateException;
import com.vineroute.hoscompliance.model.Coordinate;
import com.vineroute.hoscompliance.repository.DailyTripRepository;
import com.vineroute.hoscompliance.repository.TripWaypointRepository;
import com.vineroute.hoscompliance.util.GeoDistance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

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
 * Unit tests for DistanceTracker.
 *
 * Test cases:
 *  1. 149.99 / 150.00 / 150.01 nmi boundary (strictly greater than the radius)
 *  2. appendWaypoint stores the sample and raises the running maximum
 *  3. finalizeDay rescans all waypoints
 *  4. finalizeDay without waypoints → noLocationData, not exceeded
 */
@ExtendWith(MockitoExtension.class)
class DistanceTrackerTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private DailyTripRepository    dailyTripRepository;
    @Mock private TripWaypointRepository waypointRepository;

    private DistanceTracker distanceTracker;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final Long DRIVER_ID  = 7L;
    private static final Long VEHICLE_ID = 2L;
    private static final Long TRIP_ID    = 40L;
    private static final LocalDate DAY   = LocalDate.of(2026, 6, 10);

    private static final Coordinate BASE = Coordinate.of(46.0645, -118.3430);
    private static final Instant NOW     = Instant.parse("2026-06-11T02:00:00Z");

    @BeforeEach
    void setUp() {
        CarrierProfile profile = CarrierProfile.builder()
                .baseName("Walla Walla Travel Office")
                .baseCoordinate(BASE)
                .zoneId(ZoneId.of("America/Los_Angeles"))
                .build();
        distanceTracker = new DistanceTracker(dailyTripRepository, waypointRepository, profile,
                ComplianceRules.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ── Helper builders ───────────────────────────────────────────────────────

    private static Coordinate northOfBase(double airMiles) {
        double deltaLat = Math.toDegrees(airMiles / GeoDistance.EARTH_RADIUS_NAUTICAL_MILES);
        return Coordinate.of(BASE.getLatitude() + deltaLat, BASE.getLongitude());
    }

    private DailyTrip buildTrip() {
        return DailyTrip.builder()
                .id(TRIP_ID)
                .driverId(DRIVER_ID)
                .vehicleId(VEHICLE_ID)
                .tripDate(DAY)
                .baseLatitude(BASE.getLatitude())
                .baseLongitude(BASE.getLongitude())
                .waypointCount(0)
                .build();
    }

    private TripWaypoint waypoint(Coordinate c, String at) {
        return TripWaypoint.builder()
                .dailyTripId(TRIP_ID)
                .latitude(c.getLatitude())
                .longitude(c.getLongitude())
                .recordedAt(Instant.parse(at))
                .build();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 1 — radius boundary
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("149.99 and 150.00 nmi are inside the radius, 150.01 is outside")
    void radiusBoundary() {
        double inside = distanceTracker.distanceFromBase(northOfBase(149.99));
        double onEdge = distanceTracker.distanceFromBase(northOfBase(150.00));
        double outside = distanceTracker.distanceFromBase(northOfBase(150.01));

        assertThat(onEdge).isEqualTo(150.00);
        assertThat(distanceTracker.isBeyondRadius(inside)).isFalse();
        assertThat(distanceTracker.isBeyondRadius(onEdge)).isFalse();
        assertThat(distanceTracker.isBeyondRadius(outside)).isTrue();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 2 — running maximum
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("appendWaypoint saves the sample and raises the maximum with the exceeded flag")
    void appendWaypoint_raisesMaximum() {
        DailyTrip trip = buildTrip();
        Coordinate far = northOfBase(200);

        distanceTracker.appendWaypoint(trip, far, Instant.parse("2026-06-10T18:00:00Z"));

        ArgumentCaptor<TripWaypoint> saved = ArgumentCaptor.forClass(TripWaypoint.class);
        verify(waypointRepository).save(saved.capture());
        assertThat(saved.getValue().getDailyTripId()).isEqualTo(TRIP_ID);
        assertThat(saved.getValue().getLatitude()).isEqualTo(far.getLatitude());

        verify(dailyTripRepository).raiseMaxDistance(eq(TRIP_ID), eq(200.00), eq(true),
                eq(far.getLatitude()), eq(far.getLongitude()));
    }

    @Test
    @DisplayName("Invalid waypoint is rejected before anything is stored")
    void appendWaypoint_invalidCoordinate() {
        DailyTrip trip = buildTrip();

        assertThatThrownBy(() -> distanceTracker.appendWaypoint(trip, Coordinate.of(95, 0), Instant.now()))
                .isInstanceOf(InvalidCoordinateException.class);

        verifyNoInteractions(waypointRepository);
        verify(dailyTripRepository, never()).raiseMaxDistance(anyLong(), anyDouble(), anyBoolean(), anyDouble(), anyDouble());
    }

    @Test
    @DisplayName("initializeDay creates the DailyTrip on first use and seeds it with the first point")
    void initializeDay_createsTrip() {
        when(dailyTripRepository.findByDriverIdAndTripDate(DRIVER_ID, DAY)).thenReturn(Optional.empty());
        when(dailyTripRepository.save(any(DailyTrip.class))).thenAnswer(inv -> {
            DailyTrip t = inv.getArgument(0);
            t.setId(TRIP_ID);
            return t;
        });

        DailyTrip trip = distanceTracker.initializeDay(DRIVER_ID, VEHICLE_ID, DAY, BASE,
                Instant.parse("2026-06-10T15:00:00Z"));

        assertThat(trip.getId()).isEqualTo(TRIP_ID);
        assertThat(trip.getBaseLatitude()).isEqualTo(BASE.getLatitude());
        assertThat(trip.isExceededRadius()).isFalse();
        verify(waypointRepository).save(any(TripWaypoint.class));
        verify(dailyTripRepository).raiseMaxDistance(eq(TRIP_ID), eq(0.0), eq(false), anyDouble(), anyDouble());
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 3 / 4 — finalize
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("finalizeDay keeps the furthest waypoint and flags the exceedance")
    void finalizeDay_rescansWaypoints() {
        DailyTrip trip = buildTrip();
        Coordinate far = northOfBase(200);
        when(dailyTripRepository.findByDriverIdAndTripDate(DRIVER_ID, DAY)).thenReturn(Optional.of(trip));
        when(waypointRepository.findByDailyTripIdOrderByRecordedAtAsc(TRIP_ID)).thenReturn(List.of(
                waypoint(BASE, "2026-06-10T15:00:00Z"),
                waypoint(far, "2026-06-10T18:00:00Z"),
                waypoint(northOfBase(20), "2026-06-10T23:30:00Z")));
        when(dailyTripRepository.save(any(DailyTrip.class))).thenAnswer(inv -> inv.getArgument(0));

        DailyTrip result = distanceTracker.finalizeDay(DRIVER_ID, DAY);

        assertThat(result.getMaxAirMiles()).isEqualTo(200.00);
        assertThat(result.getFurthestLatitude()).isEqualTo(far.getLatitude());
        assertThat(result.isExceededRadius()).isTrue();
        assertThat(result.isNoLocationData()).isFalse();
        assertThat(result.getWaypointCount()).isEqualTo(3);
        assertThat(result.getFinalizedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("finalizeDay without waypoints → noLocationData, exceeded=false, no maximum")
    void finalizeDay_noWaypoints() {
        DailyTrip trip = buildTrip();
        when(dailyTripRepository.findByDriverIdAndTripDate(DRIVER_ID, DAY)).thenReturn(Optional.of(trip));
        when(waypointRepository.findByDailyTripIdOrderByRecordedAtAsc(TRIP_ID)).thenReturn(List.of());
        when(dailyTripRepository.save(any(DailyTrip.class))).thenAnswer(inv -> inv.getArgument(0));

        DailyTrip result = distanceTracker.finalizeDay(DRIVER_ID, DAY);

        assertThat(result.isNoLocationData()).isTrue();
        assertThat(result.isExceededRadius()).isFalse();
        assertThat(result.getMaxAirMiles()).isNull();
        assertThat(result.getWaypointCount()).isZero();
    }
}
