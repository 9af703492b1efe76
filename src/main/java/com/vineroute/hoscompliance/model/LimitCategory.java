package com.vineroute.hoscompliance.model;

public enum LimitCategory {
    DAILY_DRIVING,
    DAILY_ON_DUTY,
    WEEKLY_ON_DUTY,
    EXEMPTION_WINDOW
}
