package com.vineroute.hoscompliance.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One compliance finding. observed/limit are in the unit of the rule
 * (hours for HOS rules, days for the exemption window) and may be null
 * for data-quality warnings.
 */
@Value
@Builder
public class ComplianceViolation {

    ViolationType type;
    Severity severity;
    LocalDate date;
    String message;
    BigDecimal observed;
    BigDecimal limit;

    public String getRegulation() {
        return type.getRegulation();
    }
}
