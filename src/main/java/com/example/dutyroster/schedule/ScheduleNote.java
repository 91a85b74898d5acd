package com.example.dutyroster.schedule;

import com.example.dutyroster.calendar.DutySlot;

import java.time.LocalDate;

/**
 * Informational record attached to a run. {@code slot} is null for notes about
 * slots that were never generated.
 */
public record ScheduleNote(Type type, LocalDate date, DutySlot slot, String message) {

    public enum Type {
        SKIPPED_HOLIDAY,
        FIXED_PATTERN_FALLBACK
    }

    public static ScheduleNote skippedHoliday(LocalDate date, String message) {
        return new ScheduleNote(Type.SKIPPED_HOLIDAY, date, null, message);
    }

    public static ScheduleNote fixedPatternFallback(DutySlot slot, String message) {
        return new ScheduleNote(Type.FIXED_PATTERN_FALLBACK, slot.date(), slot, message);
    }
}
