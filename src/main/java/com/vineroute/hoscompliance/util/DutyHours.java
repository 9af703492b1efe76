package com.vineroute.hoscompliance.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;

/**
 * Hour arithmetic for time cards. Hours are BigDecimal with two decimals,
 * rounded half-up, so 08:00 → 16:30 is exactly 8.50.
 */
public final class DutyHours {

    public static final int SCALE = 2;

    private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private DutyHours() {
    }

    /**
     * Elapsed wall-clock hours between two instants; zero if {@code to} is not after {@code from}.
     */
    public static BigDecimal between(Instant from, Instant to) {
        long seconds = Duration.between(from, to).getSeconds();
        if (seconds <= 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return BigDecimal.valueOf(seconds).divide(SECONDS_PER_HOUR, SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal sum(Collection<BigDecimal> hours) {
        return hours.stream()
                .map(DutyHours::orZero)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal orZero(BigDecimal hours) {
        return hours != null ? hours : BigDecimal.ZERO;
    }

    /**
     * used / limit as a percentage with one decimal. A zero limit counts as fully used.
     */
    public static BigDecimal percentOf(BigDecimal used, BigDecimal limit) {
        if (limit.signum() <= 0) {
            return HUNDRED.setScale(1);
        }
        return used.multiply(HUNDRED).divide(limit, 1, RoundingMode.HALF_UP);
    }

    /** limit − used, floored at zero */
    public static BigDecimal remaining(BigDecimal used, BigDecimal limit) {
        BigDecimal r = limit.subtract(used);
        return r.signum() < 0 ? BigDecimal.ZERO.setScale(used.scale()) : r;
    }
}
