package com.example.dutyroster.constraint;

import com.example.dutyroster.calendar.DutySlot;
import com.example.dutyroster.calendar.ShiftType;
import com.example.dutyroster.config.RotationRules;
import com.example.dutyroster.history.HistoryWindow;
import com.example.dutyroster.member.Member;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Hard exclusions evaluated against configuration and already committed slots only.
 * Never looks at slots later than the one being evaluated.
 */
public class ExclusionRules {

    private final RotationRules rules;
    private final HistoryWindow history;
    private final NgRuleSet ngRules;

    public ExclusionRules(RotationRules rules, HistoryWindow history, NgRuleSet ngRules) {
        this.rules = rules;
        this.history = history;
        this.ngRules = ngRules;
    }

    /**
     * Every exclusion that applies, in a fixed order. An empty list means the member may take the slot.
     *
     * @param committed slots already committed to this member in the current run
     */
    public List<Elimination> check(Member member, DutySlot slot, Collection<DutySlot> committed) {
        List<Elimination> found = new ArrayList<>();
        if (!member.active()) {
            found.add(Elimination.of(EliminationReason.INACTIVE, null));
        }
        LocalDate date = slot.date();
        if (slot.shiftType() == ShiftType.DAY && ngRules.isGlobalDate(date)) {
            found.add(Elimination.of(EliminationReason.GLOBAL_NG, date.toString()));
        }
        for (NgRule rule : ngRules.forMember(member.name())) {
            if (rule.covers(date)) {
                EliminationReason reason = rule.kind() == NgRule.Kind.MEMBER_PERIOD
                        ? EliminationReason.NG_PERIOD : EliminationReason.NG_DATE;
                found.add(Elimination.of(reason, rule.describe()));
                break;
            }
        }
        Set<LocalDate> nightWeeks = new TreeSet<>(history.nightWeeks(member.name()));
        for (DutySlot own : committed) {
            if (own.shiftType() == ShiftType.NIGHT) {
                nightWeeks.add(own.date());
            }
        }
        overlapWith(slot, committed, history.nightWeeks(member.name())).ifPresent(found::add);
        if (slot.shiftType() == ShiftType.DAY) {
            cooldownBreach(date, nightWeeks).ifPresent(found::add);
        }
        return found;
    }

    public boolean isExcluded(Member member, DutySlot slot, Collection<DutySlot> committed) {
        return !check(member, slot, committed).isEmpty();
    }

    private Optional<Elimination> overlapWith(DutySlot slot, Collection<DutySlot> committed, Set<LocalDate> historyWeeks) {
        for (DutySlot own : committed) {
            if (own.overlaps(slot)) {
                return Optional.of(Elimination.of(EliminationReason.OVERLAP, own.label()));
            }
        }
        for (LocalDate week : historyWeeks) {
            if (DutySlot.night(week, 1).overlaps(slot)) {
                return Optional.of(Elimination.of(EliminationReason.OVERLAP, "history night week " + week));
            }
        }
        return Optional.empty();
    }

    private Optional<Elimination> cooldownBreach(LocalDate dayDate, Set<LocalDate> nightWeeks) {
        for (LocalDate week : nightWeeks) {
            LocalDate nightEnd = week.plusDays(ShiftType.NIGHT.spanDays());
            long since = ChronoUnit.DAYS.between(nightEnd, dayDate);
            if (since > 0 && since < rules.nightToDayCooldownDays()) {
                return Optional.of(Elimination.of(EliminationReason.COOLDOWN,
                        "night week " + week + " ended " + since + " day(s) earlier"));
            }
        }
        return Optional.empty();
    }
}
