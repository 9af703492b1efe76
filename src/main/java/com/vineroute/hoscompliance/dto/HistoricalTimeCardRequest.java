package com.vineroute.hoscompliance.dto;

import com.vineroute.hoscompliance.model.Coordinate;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.time.Instant;

/**
 * Back-fill of a shift recorded on paper. The furthest point, when known,
 * stands in for the day's waypoints.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalTimeCardRequest {

    @NotNull(message = "Driver ID is required")
    private Long driverId;

    @NotNull(message = "Vehicle ID is required")
    private Long vehicleId;

    @NotNull(message = "Clock-in time is required")
    private Instant clockInAt;

    @NotNull(message = "Clock-out time is required")
    private Instant clockOutAt;

    private Double furthestLatitude;

    private Double furthestLongitude;

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    private String notes;

    public Coordinate furthestPoint() {
        return RequestCoordinates.of(furthestLatitude, furthestLongitude);
    }
}
