package com.example.dutyroster.member;

import com.example.dutyroster.calendar.ShiftType;

import java.util.Optional;

/**
 * Roster entry. A member serves the day shift when {@code dayGroup} is set and the
 * night shift when {@code nightGroup} is set; either may be absent but not both.
 *
 * @param minDayIntervalDays   per-member day spacing, {@code null} for the rule default
 * @param minNightIntervalDays per-member night spacing, {@code null} for the rule default
 */
public record Member(String name,
                     boolean active,
                     IndexGroup dayGroup,
                     IndexGroup nightGroup,
                     Integer minDayIntervalDays,
                     Integer minNightIntervalDays) {

    public Member {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Member name is required");
        }
        name = name.strip();
        if (dayGroup == null && nightGroup == null) {
            throw new IllegalArgumentException("Member " + name + " belongs to neither the day nor the night shift");
        }
        if (dayGroup != null && dayGroup.shiftType() != ShiftType.DAY) {
            throw new IllegalArgumentException("Member " + name + ": " + dayGroup + " is not a day-shift group");
        }
        if (nightGroup != null && nightGroup.shiftType() != ShiftType.NIGHT) {
            throw new IllegalArgumentException("Member " + name + ": " + nightGroup + " is not a night-shift group");
        }
        if (minDayIntervalDays != null && minDayIntervalDays < 0
                || minNightIntervalDays != null && minNightIntervalDays < 0) {
            throw new IllegalArgumentException("Member " + name + ": interval overrides must not be negative");
        }
    }

    public static Member of(String name, IndexGroup dayGroup, IndexGroup nightGroup) {
        return new Member(name, true, dayGroup, nightGroup, null, null);
    }

    public Member inactive() {
        return new Member(name, false, dayGroup, nightGroup, minDayIntervalDays, minNightIntervalDays);
    }

    public Member withIntervals(Integer minDay, Integer minNight) {
        return new Member(name, active, dayGroup, nightGroup, minDay, minNight);
    }

    public Optional<IndexGroup> groupFor(ShiftType shiftType) {
        return Optional.ofNullable(shiftType == ShiftType.DAY ? dayGroup : nightGroup);
    }

    public boolean serves(ShiftType shiftType) {
        return groupFor(shiftType).isPresent();
    }

    public Optional<Integer> minIntervalOverride(ShiftType shiftType) {
        return Optional.ofNullable(shiftType == ShiftType.DAY ? minDayIntervalDays : minNightIntervalDays);
    }
}
