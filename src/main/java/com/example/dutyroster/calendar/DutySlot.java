package com.example.dutyroster.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Comparator;

/**
 * A single fillable duty position. For night shifts {@code date} is the Monday
 * that starts the covered week.
 */
public record DutySlot(LocalDate date, ShiftType shiftType, int index) implements Comparable<DutySlot> {

    private static final Comparator<DutySlot> ORDER = Comparator
            .comparing(DutySlot::date)
            .thenComparing(DutySlot::shiftType)
            .thenComparingInt(DutySlot::index);

    public DutySlot {
        if (date == null || shiftType == null) {
            throw new IllegalArgumentException("date and shiftType are required");
        }
        if (!shiftType.isValidIndex(index)) {
            throw new IllegalArgumentException("index " + index + " is out of range for " + shiftType);
        }
        DayOfWeek dow = date.getDayOfWeek();
        if (shiftType == ShiftType.DAY && dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY) {
            throw new IllegalArgumentException("day shift must fall on a weekend: " + date);
        }
        if (shiftType == ShiftType.NIGHT && dow != DayOfWeek.MONDAY) {
            throw new IllegalArgumentException("night shift must start on a Monday: " + date);
        }
    }

    public static DutySlot day(LocalDate date, int index) {
        return new DutySlot(date, ShiftType.DAY, index);
    }

    public static DutySlot night(LocalDate weekStart, int index) {
        return new DutySlot(weekStart, ShiftType.NIGHT, index);
    }

    public LocalDate spanStart() {
        return date;
    }

    public LocalDate spanEnd() {
        return date.plusDays(shiftType.spanDays());
    }

    public boolean covers(LocalDate day) {
        return !day.isBefore(spanStart()) && !day.isAfter(spanEnd());
    }

    public boolean overlaps(DutySlot other) {
        return !other.spanStart().isAfter(spanEnd()) && !spanStart().isAfter(other.spanEnd());
    }

    public String label() {
        return date + " " + shiftType + "#" + index;
    }

    @Override
    public int compareTo(DutySlot other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return label();
    }
}
