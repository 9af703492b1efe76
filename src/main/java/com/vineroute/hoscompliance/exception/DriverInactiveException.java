package com.vineroute.hoscompliance.exception;

public class DriverInactiveException extends ComplianceException {

    public DriverInactiveException(Long driverId) {
        super(ErrorCategory.VALIDATION, "Driver #" + driverId + " is not active");
    }
}
