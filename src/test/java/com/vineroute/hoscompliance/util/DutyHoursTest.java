package com.vineroute.hoscompliance.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class DutyHoursTest {

    @Test
    @DisplayName("08:00 → 16:30 is exactly 8.50 h")
    void eightAndAHalf() {
        BigDecimal h = DutyHours.between(Instant.parse("2026-06-10T15:00:00Z"), Instant.parse("2026-06-10T23:30:00Z"));
        assertThat(h).isEqualByComparingTo("8.50");
        assertThat(h.scale()).isEqualTo(2);
    }

    @Test
    @DisplayName("Hours round half-up to two decimals")
    void roundsHalfUp() {
        // 10 min = 0.1666.. h → 0.17
        assertThat(DutyHours.between(Instant.parse("2026-06-10T15:00:00Z"), Instant.parse("2026-06-10T15:10:00Z")))
                .isEqualByComparingTo("0.17");
        // 18 s = 0.005 h → 0.01
        assertThat(DutyHours.between(Instant.parse("2026-06-10T15:00:00Z"), Instant.parse("2026-06-10T15:00:18Z")))
                .isEqualByComparingTo("0.01");
    }

    @Test
    @DisplayName("Reversed interval counts as zero")
    void reversed_isZero() {
        assertThat(DutyHours.between(Instant.parse("2026-06-10T16:00:00Z"), Instant.parse("2026-06-10T15:00:00Z")))
                .isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("sum ignores nulls, percentOf / remaining")
    void sumPercentRemaining() {
        assertThat(DutyHours.sum(Arrays.asList(new BigDecimal("4.25"), null, new BigDecimal("3.50"))))
                .isEqualByComparingTo("7.75");
        assertThat(DutyHours.percentOf(new BigDecimal("8.50"), BigDecimal.TEN)).isEqualByComparingTo("85.0");
        assertThat(DutyHours.remaining(new BigDecimal("11.00"), BigDecimal.TEN)).isEqualByComparingTo("0");
        assertThat(DutyHours.remaining(new BigDecimal("8.50"), BigDecimal.TEN)).isEqualByComparingTo("1.50");
    }
}
