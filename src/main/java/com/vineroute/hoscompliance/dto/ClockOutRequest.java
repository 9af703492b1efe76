package com.vineroute.hoscompliance.dto;

import com.vineroute.hoscompliance.model.Coordinate;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClockOutRequest {

    @NotNull(message = "Driver ID is required")
    private Long driverId;

    @NotNull(message = "Timestamp is required")
    private Instant timestamp;

    private Double latitude;

    private Double longitude;

    /** Reference to the uploaded signature image */
    @NotBlank(message = "Signature is required")
    private String signature;

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    private String notes;

    public Coordinate location() {
        return RequestCoordinates.of(latitude, longitude);
    }
}
