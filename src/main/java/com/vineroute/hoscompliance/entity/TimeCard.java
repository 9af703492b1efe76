package com.vineroute.hoscompliance.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One duty period of a driver: clock-in to clock-out.
 *
 * Open-card uniqueness is enforced by the database, not by application checks:
 * openDriverKey / openVehicleKey hold the driver and vehicle id while the card
 * is OPEN and are null otherwise. Each column carries a unique constraint, and
 * NULLs never collide, so at most one OPEN card can exist per driver and per
 * vehicle at any instant, even under concurrent clock-ins.
 */
@Entity
@Table(
    name = "time_cards",
    uniqueConstraints = {
        @UniqueConstraint(name = TimeCard.UK_OPEN_DRIVER,  columnNames = "open_driver_key"),
        @UniqueConstraint(name = TimeCard.UK_OPEN_VEHICLE, columnNames = "open_vehicle_key")
    },
    indexes = {
        @Index(name = "idx_time_cards_driver_date", columnList = "driver_id, work_date"),
        @Index(name = "idx_time_cards_status",      columnList = "status")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TimeCard {

    public static final String UK_OPEN_DRIVER  = "uk_time_cards_open_driver";
    public static final String UK_OPEN_VEHICLE = "uk_time_cards_open_vehicle";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "driver_id", nullable = false)
    private Long driverId;

    @Column(name = "vehicle_id", nullable = false)
    private Long vehicleId;

    /** Calendar date of clock-in in the carrier time zone */
    @Column(name = "work_date", nullable = false)
    private LocalDate workDate;

    @Column(nullable = false)
    private Instant clockInAt;

    private Double clockInLatitude;

    private Double clockInLongitude;

    /** GPS accuracy reported by the device, in metres */
    private Double clockInAccuracy;

    /** Null while the card is OPEN */
    private Instant clockOutAt;

    private Double clockOutLatitude;

    private Double clockOutLongitude;

    /** Reference to the stored signature image, never the image itself */
    private String signatureRef;

    @Column(precision = 5, scale = 2)
    private BigDecimal onDutyHours;

    @Column(precision = 5, scale = 2)
    private BigDecimal drivingHours;

    @Column(length = 2000)
    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TimeCardStatus status;

    @Column(name = "open_driver_key")
    private Long openDriverKey;

    @Column(name = "open_vehicle_key")
    private Long openVehicleKey;

    private boolean drivingLimitExceeded;

    private boolean onDutyLimitExceeded;

    private boolean insufficientOffDuty;

    /** Id of the card this one replaces (corrections only) */
    private Long supersedesId;

    private String correctionReason;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant updatedAt;

    public boolean isOpen() {
        return status == TimeCardStatus.OPEN;
    }

    /** Clears the uniqueness keys so the driver and vehicle can be clocked in again */
    public void releaseOpenKeys() {
        this.openDriverKey = null;
        this.openVehicleKey = null;
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
