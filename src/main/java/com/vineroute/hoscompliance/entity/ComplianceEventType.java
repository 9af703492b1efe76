package com.vineroute.hoscompliance.entity;

/**
 * Audit event types. Stored as VARCHAR via @Enumerated(EnumType.STRING).
 */
public enum ComplianceEventType {

    CLOCK_IN,

    CLOCK_OUT,

    /** A time card was superseded by an administrative correction */
    TIME_CARD_CORRECTED,

    /** A past shift was entered after the fact */
    HISTORICAL_ENTRY,

    /** Daily, weekly or off-duty limit crossed */
    HOS_VIOLATION,

    /** Exemption flag flipped in either direction */
    EXEMPTION_STATUS_CHANGED,

    /** Day closed without any GPS waypoint */
    NO_LOCATION_DATA
}
