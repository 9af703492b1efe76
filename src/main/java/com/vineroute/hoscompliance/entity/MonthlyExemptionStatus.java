package com.vineroute.hoscompliance.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Snapshot of the rolling exemption window. Always overwritten by a full
 * recount of daily_trips, never incremented.
 */
@Entity
@Table(
    name = "monthly_exemption_status",
    uniqueConstraints = @UniqueConstraint(name = "uk_exemption_driver_window",
            columnNames = {"driver_id", "window_start"})
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MonthlyExemptionStatus {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "driver_id", nullable = false)
    private Long driverId;

    @Column(name = "window_start", nullable = false)
    private LocalDate windowStart;

    @Column(nullable = false)
    private LocalDate windowEnd;

    @Column(nullable = false)
    private int exceedanceDays;

    @Column(nullable = false)
    private boolean requiresDetailedLogs;

    private Instant evaluatedAt;
}
