package com.faktura.billing.domain;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Day-granularity date arithmetic.
 */
public final class DayCount {

    public static final int DAYS_PER_YEAR = 365;

    private DayCount() {
    }

    /**
     * Signed number of calendar days from {@code from} to {@code to}.
     */
    public static long between(LocalDate from, LocalDate to) {
        return ChronoUnit.DAYS.between(from, to);
    }

    /**
     * Days past the due date, zero when not yet due.
     */
    public static long daysOverdue(LocalDate dueDate, LocalDate today) {
        if (dueDate == null || today == null) {
            return 0;
        }
        return Math.max(0, between(dueDate, today));
    }

    public static boolean isPastDue(LocalDate dueDate, LocalDate today) {
        return today.isAfter(dueDate);
    }
}
