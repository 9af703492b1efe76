package com.vineroute.hoscompliance.exception;

import java.time.Instant;

/**
 * Clock-out timestamp is not strictly after clock-in (device clock skew or bad correction).
 */
public class ClockOutBeforeClockInException extends ComplianceException {

    public ClockOutBeforeClockInException(Instant clockIn, Instant clockOut) {
        super(ErrorCategory.VALIDATION,
                "Clock-out " + clockOut + " must be after clock-in " + clockIn);
    }
}
