package com.vineroute.hoscompliance.model;

/**
 * Alert / violation severity. Declaration order is ascending, so
 * {@code compareTo} can be used to sort critical alerts first.
 */
public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}
