package com.vineroute.hoscompliance.exception;

/**
 * Another driver holds an OPEN time card against the vehicle.
 */
public class VehicleInUseException extends ComplianceException {

    public VehicleInUseException(Long vehicleId) {
        super(ErrorCategory.CONFLICT, "Vehicle #" + vehicleId + " is in use by another driver");
    }

    public VehicleInUseException(Long vehicleId, Long holderDriverId) {
        super(ErrorCategory.CONFLICT,
                "Vehicle #" + vehicleId + " is in use by driver #" + holderDriverId);
    }
}
