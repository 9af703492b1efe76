package com.vineroute.hoscompliance.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Roster entry for a passenger vehicle
 */
@Entity
@Table(name = "vehicles")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Vehicle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String vehicleNumber;

    private String make;

    private String model;

    /** Passenger seats */
    private Integer capacity;

    @Column(nullable = false)
    private boolean active;

}
