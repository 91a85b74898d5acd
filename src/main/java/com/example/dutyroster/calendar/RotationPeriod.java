package com.example.dutyroster.calendar;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive rotation window. By convention it runs from the 21st of a month to
 * the 20th two calendar months later.
 */
public record RotationPeriod(LocalDate start, LocalDate end) {

    public static final int CONVENTIONAL_START_DAY = 21;
    public static final int ROTATION_MONTHS = 2;

    /**
     * Builds the conventional period for the given start, ending the day before
     * the same day-of-month two months later.
     */
    public static RotationPeriod implied(LocalDate start) {
        if (start == null) {
            return new RotationPeriod(null, null);
        }
        return new RotationPeriod(start, start.plusMonths(ROTATION_MONTHS).minusDays(1));
    }

    public static RotationPeriod of(LocalDate start, LocalDate end) {
        return end == null ? implied(start) : new RotationPeriod(start, end);
    }

    public long lengthInDays() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    public boolean contains(LocalDate day) {
        return !day.isBefore(start) && !day.isAfter(end);
    }

    @Override
    public String toString() {
        return start + "~" + end;
    }
}
