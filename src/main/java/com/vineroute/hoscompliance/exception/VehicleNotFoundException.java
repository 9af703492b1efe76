package com.vineroute.hoscompliance.exception;

public class VehicleNotFoundException extends ComplianceException {

    public VehicleNotFoundException(Long vehicleId) {
        super(ErrorCategory.NOT_FOUND, "Vehicle not found: " + vehicleId);
    }
}
