package com.vineroute.hoscompliance.dto;

import com.vineroute.hoscompliance.model.Coordinate;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.time.Instant;

/**
 * Clock-in from the driver app. Location is optional (no GPS fix yet),
 * but latitude and longitude must be sent together.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClockInRequest {

    @NotNull(message = "Driver ID is required")
    private Long driverId;

    @NotNull(message = "Vehicle ID is required")
    private Long vehicleId;

    @NotNull(message = "Timestamp is required")
    private Instant timestamp;

    private Double latitude;

    private Double longitude;

    private Double accuracy; // metres

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    private String notes;

    /**
     * @return the clock-in location, or null when none was sent
     */
    public Coordinate location() {
        return RequestCoordinates.of(latitude, longitude);
    }
}
