package com.vineroute.hoscompliance.entity;

import com.vineroute.hoscompliance.model.Severity;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Append-only compliance audit trail.
 *
 * timestamp is server time at evaluation, never the device timestamp of the
 * triggering request; createdAt is stamped on insert.
 */
@Entity
@Table(
    name = "compliance_events",
    indexes = {
        @Index(name = "idx_compliance_events_driver",    columnList = "driver_id, event_timestamp"),
        @Index(name = "idx_compliance_events_time_card", columnList = "time_card_id")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ComplianceEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "driver_id", nullable = false)
    private Long driverId;

    private Long vehicleId;

    @Column(name = "time_card_id")
    private Long timeCardId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 40)
    private ComplianceEventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Severity severity;

    @Column(length = 1000)
    private String message;

    private Double latitude;

    private Double longitude;

    @Column(name = "event_timestamp", nullable = false)
    private Instant timestamp;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
