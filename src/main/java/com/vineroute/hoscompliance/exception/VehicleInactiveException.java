package com.vineroute.hoscompliance.exception;

/**
 * Vehicle is marked inactive in the roster (maintenance, retired).
 */
public class VehicleInactiveException extends ComplianceException {

    public VehicleInactiveException(Long vehicleId) {
        super(ErrorCategory.VALIDATION, "Vehicle #" + vehicleId + " is not currently active");
    }
}
