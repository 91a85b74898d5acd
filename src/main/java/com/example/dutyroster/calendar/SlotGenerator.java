package com.example.dutyroster.calendar;

import com.example.dutyroster.config.RotationRules;
import com.example.dutyroster.exception.InvalidPeriodException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Expands a rotation period into its duty slots: three day positions for every
 * Saturday and Sunday, two night positions for every Monday in the period.
 * A night week anchored on the last Monday may run past the period end.
 */
public class SlotGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SlotGenerator.class);
    private static final int WORKING_DAYS_PER_WEEK = 5;

    private final RotationRules rules;

    public SlotGenerator(RotationRules rules) {
        this.rules = rules;
    }

    public SlotPlan generate(RotationPeriod period) {
        return generate(period, Collections.emptySet());
    }

    /**
     * @param holidays global NG dates; weekend days on these dates get no day slots,
     *                 and a week whose Monday to Friday are all holidays gets no night slots
     */
    public SlotPlan generate(RotationPeriod period, Set<LocalDate> holidays) {
        validate(period);
        List<DutySlot> slots = new ArrayList<>();
        List<LocalDate> skippedDays = new ArrayList<>();
        List<LocalDate> skippedWeeks = new ArrayList<>();
        for (LocalDate day = period.start(); !day.isAfter(period.end()); day = day.plusDays(1)) {
            DayOfWeek dow = day.getDayOfWeek();
            if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
                if (holidays.contains(day)) {
                    skippedDays.add(day);
                    continue;
                }
                for (int index = 1; index <= ShiftType.DAY.positions(); index++) {
                    slots.add(DutySlot.day(day, index));
                }
            } else if (dow == DayOfWeek.MONDAY) {
                if (isClosedWeek(day, holidays)) {
                    skippedWeeks.add(day);
                    continue;
                }
                for (int index = 1; index <= ShiftType.NIGHT.positions(); index++) {
                    slots.add(DutySlot.night(day, index));
                }
            }
        }
        if (!skippedDays.isEmpty() || !skippedWeeks.isEmpty()) {
            logger.info("Holiday slots skipped for {}: days={}, nightWeeks={}", period, skippedDays, skippedWeeks);
        }
        return new SlotPlan(period, slots, skippedDays, skippedWeeks);
    }

    private void validate(RotationPeriod period) {
        if (period == null || period.start() == null || period.end() == null) {
            throw new InvalidPeriodException("Rotation start date is required",
                    period == null ? null : period.start(), period == null ? null : period.end());
        }
        if (period.end().isBefore(period.start())) {
            throw new InvalidPeriodException("Rotation end " + period.end() + " precedes start " + period.start(),
                    period.start(), period.end());
        }
        long span = period.lengthInDays();
        if (span < 7) {
            throw new InvalidPeriodException("Rotation must cover at least one full week of night duty (" + span + " days given)",
                    period.start(), period.end());
        }
        if (span > rules.maxSpanDays()) {
            throw new InvalidPeriodException("Rotation may span at most " + rules.maxSpanDays() + " days (" + span + " days given)",
                    period.start(), period.end());
        }
    }

    private boolean isClosedWeek(LocalDate monday, Set<LocalDate> holidays) {
        if (holidays.isEmpty()) {
            return false;
        }
        for (int i = 0; i < WORKING_DAYS_PER_WEEK; i++) {
            if (!holidays.contains(monday.plusDays(i))) {
                return false;
            }
        }
        return true;
    }
}
