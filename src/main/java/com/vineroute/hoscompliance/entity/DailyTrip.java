package com.vineroute.hoscompliance.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Per driver per work date: how far from base the driver got.
 *
 * maxAirMiles only ever grows while waypoints arrive (see
 * DailyTripRepository#raiseMaxDistance); exceededRadius is always
 * written together with it and never set on its own.
 */
@Entity
@Table(
    name = "daily_trips",
    uniqueConstraints = @UniqueConstraint(name = "uk_daily_trips_driver_date",
            columnNames = {"driver_id", "trip_date"}),
    indexes = @Index(name = "idx_daily_trips_exceeded", columnList = "driver_id, exceeded_radius, trip_date")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyTrip {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "driver_id", nullable = false)
    private Long driverId;

    private Long vehicleId;

    @Column(name = "trip_date", nullable = false)
    private LocalDate tripDate;

    private String baseName;

    @Column(nullable = false)
    private Double baseLatitude;

    @Column(nullable = false)
    private Double baseLongitude;

    private Double furthestLatitude;

    private Double furthestLongitude;

    /** Maximum distance from base, nautical miles, 2 decimals */
    private Double maxAirMiles;

    @Column(name = "exceeded_radius", nullable = false)
    private boolean exceededRadius;

    /** Set on finalize when the day has no waypoint at all */
    private boolean noLocationData;

    private Integer waypointCount;

    private Instant finalizedAt;

}
