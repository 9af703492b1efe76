package com.vineroute.hoscompliance.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.time.Instant;

/**
 * Admin correction of a time card. The original card is kept as SUPERSEDED
 * and a new CLOSED card is created with these times.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TimeCardCorrectionRequest {

    @NotNull(message = "Clock-in time is required")
    private Instant clockInAt;

    @NotNull(message = "Clock-out time is required")
    private Instant clockOutAt;

    @NotBlank(message = "Correction reason is required")
    @Size(max = 255, message = "Reason must be at most 255 characters")
    private String reason;

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    private String notes;
}
