package com.example.dutyroster.history;

import com.example.dutyroster.calendar.ShiftType;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * One past assignment. Night records may carry any date of the covered week.
 */
public record HistoryRecord(LocalDate date, ShiftType shiftType, int index, String memberName) {

    public HistoryRecord {
        if (date == null) {
            throw new IllegalArgumentException("History record requires a calendar date");
        }
        if (shiftType == null || !shiftType.isValidIndex(index)) {
            throw new IllegalArgumentException("History record on " + date + " has invalid position "
                    + shiftType + "#" + index);
        }
        if (memberName == null || memberName.isBlank()) {
            throw new IllegalArgumentException("History record on " + date + " has no member");
        }
        memberName = memberName.strip();
    }

    /**
     * The date interval rules compare against: the day itself for day shifts,
     * the Monday of the week for night shifts.
     */
    public LocalDate dutyDate() {
        return shiftType == ShiftType.NIGHT ? date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)) : date;
    }
}
