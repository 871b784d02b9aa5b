package com.adpilot.port;

import java.time.LocalDate;

public record DateRange(LocalDate from, LocalDate to) {

    public DateRange {
        if (from == null || to == null || from.isAfter(to)) {
            throw new IllegalArgumentException("Invalid date range " + from + ".." + to);
        }
    }

    /**
     * The {@code days} days ending on {@code today}.
     */
    public static DateRange lastDays(int days, LocalDate today) {
        return new DateRange(today.minusDays(Math.max(0, days)), today);
    }
}
