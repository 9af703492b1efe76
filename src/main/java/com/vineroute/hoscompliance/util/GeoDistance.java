package com.vineroute.hoscompliance.util;

import com.vineroute.hoscompliance.exception.InvalidCoordinateException;
import com.vineroute.hoscompliance.model.Coordinate;

/**
 * Great-circle ("air-mile") distance between two GPS coordinates.
 *
 * The short-haul exemption radius is expressed in air miles, i.e. nautical
 * miles, so the Earth radius used here is 3440.065 nmi rather than metres.
 */
public final class GeoDistance {

    /** Mean Earth radius in nautical miles */
    public static final double EARTH_RADIUS_NAUTICAL_MILES = 3440.065;

    private GeoDistance() {
    }

    /**
     * Haversine distance between two coordinates.
     *
     * @param a first point
     * @param b second point
     * @return distance in nautical (air) miles
     * @throws InvalidCoordinateException if either point is out of range or not finite
     */
    public static double distance(Coordinate a, Coordinate b) {
        validate(a);
        validate(b);

        double lat1Rad = Math.toRadians(a.getLatitude());
        double lat2Rad = Math.toRadians(b.getLatitude());
        double deltaLat = lat2Rad - lat1Rad;
        double deltaLon = Math.toRadians(b.getLongitude() - a.getLongitude());

        double h = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2) +
                   Math.cos(lat1Rad) * Math.cos(lat2Rad) *
                   Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));

        return EARTH_RADIUS_NAUTICAL_MILES * c;
    }

    /**
     * @throws InvalidCoordinateException unless lat ∈ [-90, 90] and lng ∈ [-180, 180]
     */
    public static Coordinate validate(Coordinate point) {
        if (point == null) {
            throw new InvalidCoordinateException(Double.NaN, Double.NaN);
        }
        double lat = point.getLatitude();
        double lng = point.getLongitude();
        if (!Double.isFinite(lat) || !Double.isFinite(lng)
                || lat < -90.0 || lat > 90.0
                || lng < -180.0 || lng > 180.0) {
            throw new InvalidCoordinateException(lat, lng);
        }
        return point;
    }

    public static boolean isValid(Coordinate point) {
        try {
            validate(point);
            return true;
        } catch (InvalidCoordinateException e) {
            return false;
        }
    }
}
