package com.vineroute.hoscompliance.entity;

/**
 * Time card lifecycle: OPEN → CLOSED, and OPEN|CLOSED → SUPERSEDED by a correction.
 */
public enum TimeCardStatus {

    /** Clocked in, not yet clocked out */
    OPEN,

    /** Clocked out, hours computed and evaluated */
    CLOSED,

    /** Replaced by a correction; kept for the audit trail, excluded from every aggregate */
    SUPERSEDED
}
