package com.vineroute.hoscompliance.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Cumulative on-duty hours over the rolling 7 or 8 days ending at windowEnd.
 */
@Entity
@Table(
    name = "weekly_hos",
    uniqueConstraints = @UniqueConstraint(name = "uk_weekly_hos_driver_end",
            columnNames = {"driver_id", "window_end"})
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WeeklyHos {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "driver_id", nullable = false)
    private Long driverId;

    @Column(nullable = false)
    private LocalDate windowStart;

    @Column(name = "window_end", nullable = false)
    private LocalDate windowEnd;

    private int windowDays;

    @Column(precision = 6, scale = 2)
    private BigDecimal totalOnDutyHours;

    @Column(precision = 6, scale = 2)
    private BigDecimal totalDrivingHours;

    private int limitHours;

    private boolean violation;

    private Instant evaluatedAt;
}
