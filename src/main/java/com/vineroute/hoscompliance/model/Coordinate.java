package com.vineroute.hoscompliance.model;

import lombok.Value;

/**
 * Immutable latitude / longitude pair in decimal degrees (WGS-84).
 * Range checks live in {@link com.vineroute.hoscompliance.util.GeoDistance#validate(Coordinate)}.
 */
@Value
public class Coordinate {

    double latitude;
    double longitude;

    public static Coordinate of(double latitude, double longitude) {
        return new Coordinate(latitude, longitude);
    }

    @Override
    public String toString() {
        return String.format("(%.5f, %.5f)", latitude, longitude);
    }
}
