package com.vineroute.hoscompliance.exception;

public class TimeCardNotFoundException extends ComplianceException {

    public TimeCardNotFoundException(Long timeCardId) {
        super(ErrorCategory.NOT_FOUND, "Time card not found: " + timeCardId);
    }
}
