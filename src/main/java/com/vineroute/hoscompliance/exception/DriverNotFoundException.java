package com.vineroute.hoscompliance.exception;

public class DriverNotFoundException extends ComplianceException {

    public DriverNotFoundException(Long driverId) {
        super(ErrorCategory.NOT_FOUND, "Driver not found: " + driverId);
    }
}
