package com.vineroute.hoscompliance.config;

/**
 * Carrier operating pattern for the cumulative on-duty limit.
 * A carrier that does not operate every day of the week uses 60/7,
 * one that operates daily uses 70/8.
 */
public enum WeeklyLimit {

    SIXTY_HOURS_SEVEN_DAYS(60, 7),
    SEVENTY_HOURS_EIGHT_DAYS(70, 8);

    private final int hours;
    private final int days;

    WeeklyLimit(int hours, int days) {
        this.hours = hours;
        this.days = days;
    }

    public int getHours() {
        return hours;
    }

    public int getDays() {
        return days;
    }
}
