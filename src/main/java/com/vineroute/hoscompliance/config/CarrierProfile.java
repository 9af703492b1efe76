package com.vineroute.hoscompliance.config;

import com.vineroute.hoscompliance.model.Coordinate;
import lombok.Builder;
import lombok.Value;

import java.time.ZoneId;

/**
 * Single-carrier reference data: the work-reporting base and the time zone
 * that decides which calendar day a clock-in belongs to.
 */
@Value
@Builder
public class CarrierProfile {

    String baseName;
    Coordinate baseCoordinate;
    ZoneId zoneId;
}
