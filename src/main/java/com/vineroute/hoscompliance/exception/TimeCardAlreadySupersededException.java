package com.vineroute.hoscompliance.exception;

public class TimeCardAlreadySupersededException extends ComplianceException {

    public TimeCardAlreadySupersededException(Long timeCardId) {
        super(ErrorCategory.CONFLICT,
                "Time card #" + timeCardId + " has already been superseded by a correction");
    }
}
