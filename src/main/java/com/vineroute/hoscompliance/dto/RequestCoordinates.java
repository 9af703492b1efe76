package com.vineroute.hoscompliance.dto;

import com.vineroute.hoscompliance.model.Coordinate;

/**
 * Optional latitude / longitude pairs on request bodies.
 */
final class RequestCoordinates {

    private RequestCoordinates() {
    }

    /**
     * Null when both parts are missing. A half-sent pair becomes NaN so that
     * coordinate validation rejects it instead of silently dropping it.
     */
    static Coordinate of(Double latitude, Double longitude) {
        if (latitude == null && longitude == null) {
            return null;
        }
        return Coordinate.of(
                latitude != null ? latitude : Double.NaN,
                longitude != null ? longitude : Double.NaN);
    }
}
