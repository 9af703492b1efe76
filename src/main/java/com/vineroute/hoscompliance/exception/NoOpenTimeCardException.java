package com.vineroute.hoscompliance.exception;

public class NoOpenTimeCardException extends ComplianceException {

    public NoOpenTimeCardException(Long driverId) {
        super(ErrorCategory.CONFLICT, "Driver #" + driverId + " has no open time card");
    }
}
