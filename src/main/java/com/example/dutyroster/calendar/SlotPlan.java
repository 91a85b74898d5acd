package com.example.dutyroster.calendar;

import java.time.LocalDate;
import java.util.List;

/**
 * Ordered slots of a rotation plus the weekend dates and night weeks that were
 * left out because they fall on global holidays.
 */
public record SlotPlan(RotationPeriod period,
                       List<DutySlot> slots,
                       List<LocalDate> skippedDayDates,
                       List<LocalDate> skippedNightWeeks) {

    public SlotPlan {
        slots = List.copyOf(slots);
        skippedDayDates = List.copyOf(skippedDayDates);
        skippedNightWeeks = List.copyOf(skippedNightWeeks);
    }

    public long count(ShiftType shiftType) {
        return slots.stream().filter(s -> s.shiftType() == shiftType).count();
    }
}
