package com.vineroute.hoscompliance.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ComplianceAlert {

    /** Limit category or violation type name the alert is about */
    String source;
    Severity severity;
    String message;
}
