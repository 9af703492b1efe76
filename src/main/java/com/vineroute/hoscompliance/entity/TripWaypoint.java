package com.vineroute.hoscompliance.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A GPS sample belonging to a DailyTrip. Append-only; duplicates are harmless
 * because only the maximum distance is derived from them.
 */
@Entity
@Table(
    name = "trip_waypoints",
    indexes = @Index(name = "idx_trip_waypoints_trip_time", columnList = "daily_trip_id, recorded_at")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TripWaypoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "daily_trip_id", nullable = false)
    private Long dailyTripId;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

}
