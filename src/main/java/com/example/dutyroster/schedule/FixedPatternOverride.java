package com.example.dutyroster.schedule;

import com.example.dutyroster.calendar.DutySlot;
import com.example.dutyroster.calendar.ShiftType;
import com.example.dutyroster.config.RotationRules;
import com.example.dutyroster.history.HistoryWindow;
import com.example.dutyroster.member.Member;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Resolved fixed-pattern rule. A week is forced when the number of whole cadence
 * steps between the reference date and the week start is even.
 */
public final class FixedPatternOverride {

    private static final FixedPatternOverride NONE = new FixedPatternOverride(null, null, 0, 1);

    private final String memberName;
    private final LocalDate referenceDate;
    private final int targetIndex;
    private final int cadenceDays;

    private FixedPatternOverride(String memberName, LocalDate referenceDate, int targetIndex, int cadenceDays) {
        this.memberName = memberName;
        this.referenceDate = referenceDate;
        this.targetIndex = targetIndex;
        this.cadenceDays = cadenceDays;
    }

    public static FixedPatternOverride none() {
        return NONE;
    }

    /**
     * Resolves the settings against history. Problems are appended to {@code problems}
     * and {@link #none()} is returned when the rule cannot be applied.
     */
    public static FixedPatternOverride resolve(FixedPatternSettings settings,
                                               HistoryWindow history,
                                               RotationRules rules,
                                               List<String> problems) {
        if (settings == null || !settings.enabled()) {
            return NONE;
        }
        int before = problems.size();
        if (settings.memberName() == null || settings.memberName().isBlank()) {
            problems.add("fixed pattern has no member");
        }
        if (!ShiftType.NIGHT.isValidIndex(settings.targetIndex())) {
            problems.add("fixed pattern target index " + settings.targetIndex() + " is not a night position");
        }
        int cadence = settings.cadenceDays() == null ? rules.fixedPatternCadenceDays() : settings.cadenceDays();
        if (cadence <= 0) {
            problems.add("fixed pattern cadence must be positive");
        }
        if (problems.size() > before) {
            return NONE;
        }
        LocalDate reference = settings.referenceDate();
        if (reference == null) {
            reference = history.lastWeekAt(settings.memberName(), settings.targetIndex()).orElse(null);
            if (reference == null) {
                problems.add("fixed pattern member " + settings.memberName()
                        + " has no reference date and no night index " + settings.targetIndex() + " history");
                return NONE;
            }
        }
        return new FixedPatternOverride(settings.memberName(), reference, settings.targetIndex(), cadence);
    }

    public boolean isActive() {
        return memberName != null;
    }

    public Optional<String> memberName() {
        return Optional.ofNullable(memberName);
    }

    public Optional<LocalDate> referenceDate() {
        return Optional.ofNullable(referenceDate);
    }

    public boolean appliesTo(DutySlot slot) {
        return isActive() && slot.shiftType() == ShiftType.NIGHT && slot.index() == targetIndex;
    }

    public boolean isForcedWeek(LocalDate weekStart) {
        long steps = Math.floorDiv(ChronoUnit.DAYS.between(referenceDate, weekStart), cadenceDays);
        return Math.floorMod(steps, 2) == 0;
    }

    public Optional<String> forcedMember(DutySlot slot) {
        return appliesTo(slot) && isForcedWeek(slot.date()) ? Optional.of(memberName) : Optional.empty();
    }

    /**
     * True when the designated member must stay off the target position this week.
     */
    public boolean isOffWeekFor(Member member, DutySlot slot) {
        return appliesTo(slot) && member.name().equals(memberName) && !isForcedWeek(slot.date());
    }
}
