package com.vineroute.hoscompliance.exception;

/**
 * The driver already holds an OPEN time card.
 */
public class AlreadyClockedInException extends ComplianceException {

    public AlreadyClockedInException(Long driverId) {
        super(ErrorCategory.CONFLICT, "Driver #" + driverId + " is already clocked in");
    }

    public AlreadyClockedInException(Long driverId, String detail) {
        super(ErrorCategory.CONFLICT, "Driver #" + driverId + " is already clocked in " + detail);
    }
}
