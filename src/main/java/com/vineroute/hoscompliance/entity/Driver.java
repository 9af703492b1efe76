package com.vineroute.hoscompliance.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Roster entry for a driver. Read-only reference data for the compliance core.
 */
@Entity
@Table(name = "drivers")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Driver {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private String phoneNumber;

    private String licenseNumber;

    @Column(nullable = false)
    private boolean active;
}
