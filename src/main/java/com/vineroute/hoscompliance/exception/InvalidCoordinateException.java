package com.vineroute.hoscompliance.exception;

/**
 * Latitude outside [-90, 90], longitude outside [-180, 180], or a non-finite value.
 */
public class InvalidCoordinateException extends ComplianceException {

    public InvalidCoordinateException(double latitude, double longitude) {
        super(ErrorCategory.VALIDATION,
                "Invalid coordinate (" + latitude + ", " + longitude + ")");
    }
}
