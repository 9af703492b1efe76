package com.vineroute.hoscompliance.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * How much of one limit is used. percentUsed has one decimal place.
 */
@Value
@Builder
public class LimitUsage {

    LimitCategory category;
    BigDecimal used;
    BigDecimal limit;
    BigDecimal remaining;
    BigDecimal percentUsed;
    String unit;
}
