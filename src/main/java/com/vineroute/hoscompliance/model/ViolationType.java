package com.vineroute.hoscompliance.model;

/**
 * Compliance findings produced by the evaluators.
 * These are values, never exceptions: they do not block clock-in or clock-out.
 */
public enum ViolationType {

    /** Day's driving hours above maxDrivingHoursPerDay */
    DRIVING_LIMIT_EXCEEDED("49 CFR 395.5(a)(1)"),

    /** Day's on-duty hours above maxOnDutyHoursPerDay */
    ON_DUTY_LIMIT_EXCEEDED("49 CFR 395.5(a)(2)"),

    /** Gap since the previous shift's clock-out below minOffDutyHoursBetweenShifts */
    INSUFFICIENT_OFF_DUTY("49 CFR 395.5(a)(1)"),

    /** Rolling 7/8-day on-duty sum above the weekly limit */
    WEEKLY_LIMIT_EXCEEDED("49 CFR 395.5(b)"),

    /** More than the allowed exceedance days in the rolling window: detailed logs required */
    DETAILED_LOGS_REQUIRED("49 CFR 395.1(e)(1)"),

    /** Old exceedance days rolled out of the window: simplified time cards allowed again */
    EXEMPTION_RESTORED("49 CFR 395.1(e)(1)"),

    /** No GPS waypoint was recorded for the day; distance is unknown */
    NO_LOCATION_DATA(null);

    private final String regulation;

    ViolationType(String regulation) {
        this.regulation = regulation;
    }

    public String getRegulation() {
        return regulation;
    }
}
