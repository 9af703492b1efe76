package com.vineroute.hoscompliance.dto;

import com.vineroute.hoscompliance.model.Coordinate;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.Instant;

/**
 * One GPS sample from the driver app while on duty.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WaypointRequest {

    @NotNull(message = "Driver ID is required")
    private Long driverId;

    @NotNull(message = "Latitude is required")
    private Double latitude;

    @NotNull(message = "Longitude is required")
    private Double longitude;

    @NotNull(message = "Timestamp is required")
    private Instant timestamp;

    /**
     * @return the sample's position; a missing part becomes NaN so coordinate
     *         validation rejects it as InvalidCoordinate
     */
    public Coordinate location() {
        Coordinate point = RequestCoordinates.of(latitude, longitude);
        return point != null ? point : Coordinate.of(Double.NaN, Double.NaN);
    }
}
