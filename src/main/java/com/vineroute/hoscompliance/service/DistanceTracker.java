package com.vineroute.hoscompliance.service;

import com.vineroute.hoscompliance.config.CarrierProfile;
import com.vineroute.hoscompliance.config.ComplianceRules;
import com.vineroute.hoscompliance.entity.DailyTrip;
import com.vineroute.hoscompliance.entity.TripWaypoint;
import com.vineroute.hoscompliance.model.Coordinate;
import com.vineroute.hoscompliance.repository.DailyTripRepository;
import com.vineroute.hoscompliance.repository.TripWaypointRepository;
import com.vineroute.hoscompliance.util.GeoDistance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Tracks how far from base each driver gets on each work date.
 *
 * While the day is running, every waypoint raises DailyTrip.maxAirMiles through
 * a conditional UPDATE, so the maximum is monotonic even with concurrent
 * appends. At clock-out {@link #finalizeDay} rescans every waypoint of the day
 * and overwrites the running values with the exact result.
 *
 * Distances are compared with the radius after rounding to 0.01 nmi:
 * 150.00 is inside, 150.01 is outside.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DistanceTracker {

    private final DailyTripRepository dailyTripRepository;
    private final TripWaypointRepository waypointRepository;
    private final CarrierProfile carrierProfile;
    private final ComplianceRules rules;
    private final Clock clock;

    /**
     * Returns the driver's DailyTrip for the date, creating it on first use,
     * and records {@code firstPoint} as a waypoint when one is given.
     */
    @Transactional
    public DailyTrip initializeDay(Long driverId, Long vehicleId, LocalDate date,
                                   Coordinate firstPoint, Instant at) {
        DailyTrip trip = dailyTripRepository.findByDriverIdAndTripDate(driverId, date)
                .orElseGet(() -> createDay(driverId, vehicleId, date));

        if (firstPoint != null) {
            appendWaypoint(trip, firstPoint, at);
        }
        return trip;
    }

    private DailyTrip createDay(Long driverId, Long vehicleId, LocalDate date) {
        Coordinate base = carrierProfile.getBaseCoordinate();
        DailyTrip trip = dailyTripRepository.save(DailyTrip.builder()
                .driverId(driverId)
                .vehicleId(vehicleId)
                .tripDate(date)
                .baseName(carrierProfile.getBaseName())
                .baseLatitude(base.getLatitude())
                .baseLongitude(base.getLongitude())
                .exceededRadius(false)
                .noLocationData(false)
                .waypointCount(0)
                .build());
        log.info("Daily trip #{} opened — driver #{}, date {}", trip.getId(), driverId, date);
        return trip;
    }

    /**
     * Stores the waypoint and raises the day's maximum distance if this point is further out.
     */
    @Transactional
    public void appendWaypoint(DailyTrip trip, Coordinate point, Instant at) {
        GeoDistance.validate(point);

        waypointRepository.save(TripWaypoint.builder()
                .dailyTripId(trip.getId())
                .latitude(point.getLatitude())
                .longitude(point.getLongitude())
                .recordedAt(at)
                .build());

        double miles = distanceFromBase(point);
        int raised = dailyTripRepository.raiseMaxDistance(
                trip.getId(), miles, isBeyondRadius(miles), point.getLatitude(), point.getLongitude());

        if (raised > 0) {
            log.debug("Daily trip #{} max distance raised to {} nmi at {}", trip.getId(), miles, point);
        }
    }

    /**
     * Full rescan of the day's waypoints. A day without any waypoint is
     * marked noLocationData with exceededRadius=false and no maximum.
     */
    @Transactional
    public DailyTrip finalizeDay(Long driverId, LocalDate date) {
        DailyTrip trip = dailyTripRepository.findByDriverIdAndTripDate(driverId, date)
                .orElseGet(() -> createDay(driverId, null, date));

        List<TripWaypoint> waypoints = waypointRepository.findByDailyTripIdOrderByRecordedAtAsc(trip.getId());

        if (waypoints.isEmpty()) {
            trip.setMaxAirMiles(null);
            trip.setFurthestLatitude(null);
            trip.setFurthestLongitude(null);
            trip.setExceededRadius(false);
            trip.setNoLocationData(true);
            log.warn("Daily trip #{} finalized without location data — driver #{}, date {}",
                    trip.getId(), driverId, date);
        } else {
            double max = -1;
            TripWaypoint furthest = null;
            for (TripWaypoint w : waypoints) {
                double miles = distanceFromBase(Coordinate.of(w.getLatitude(), w.getLongitude()));
                if (miles > max) {
                    max = miles;
                    furthest = w;
                }
            }
            trip.setMaxAirMiles(max);
            trip.setFurthestLatitude(furthest.getLatitude());
            trip.setFurthestLongitude(furthest.getLongitude());
            trip.setExceededRadius(isBeyondRadius(max));
            trip.setNoLocationData(false);
            log.info("Daily trip #{} finalized — {} waypoint(s), max {} nmi, exceeded: {}",
                    trip.getId(), waypoints.size(), max, trip.isExceededRadius());
        }

        trip.setWaypointCount(waypoints.size());
        trip.setFinalizedAt(Instant.now(clock));
        return dailyTripRepository.save(trip);
    }

    @Transactional(readOnly = true)
    public Optional<DailyTrip> findDay(Long driverId, LocalDate date) {
        return dailyTripRepository.findByDriverIdAndTripDate(driverId, date);
    }

    /**
     * True when the day has no usable location: finalized without waypoints,
     * or still running with none received yet.
     */
    @Transactional(readOnly = true)
    public boolean lacksLocationData(DailyTrip trip) {
        if (trip.getFinalizedAt() != null) {
            return trip.isNoLocationData();
        }
        return waypointRepository.countByDailyTripId(trip.getId()) == 0;
    }

    /** Air miles from the carrier base, rounded to 0.01 */
    public double distanceFromBase(Coordinate point) {
        return roundAirMiles(GeoDistance.distance(carrierProfile.getBaseCoordinate(), point));
    }

    public boolean isBeyondRadius(double roundedMiles) {
        return roundedMiles > rules.getRadiusAirMiles();
    }

    static double roundAirMiles(double miles) {
        return BigDecimal.valueOf(miles).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
