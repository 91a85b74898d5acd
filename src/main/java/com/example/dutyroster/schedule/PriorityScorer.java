package com.example.dutyroster.schedule;

import com.example.dutyroster.calendar.DutySlot;
import com.example.dutyroster.calendar.ShiftType;
import com.example.dutyroster.config.RotationRules;
import com.example.dutyroster.constraint.Elimination;
import com.example.dutyroster.constraint.EliminationReason;
import com.example.dutyroster.member.Member;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Greedy fairness ordering plus the minimum-interval hard filter.
 */
public class PriorityScorer implements CandidateSelector {

    private final RotationRules rules;

    public PriorityScorer(RotationRules rules) {
        this.rules = rules;
    }

    public PriorityKey score(Member member, DutySlot slot, FairnessState state) {
        ShiftType type = slot.shiftType();
        long gap = state.lastAssigned(member.name(), type)
                .map(last -> ChronoUnit.DAYS.between(last, slot.date()))
                .orElse(PriorityKey.NEVER_ASSIGNED);
        return new PriorityKey(state.totalCount(member.name(), type), gap, member.name());
    }

    /**
     * Minimum days between two assignments of the slot's shift type. A member override
     * wins, then the relaxed day index-3 interval when configured, then the rule default.
     */
    public int requiredInterval(Member member, DutySlot slot) {
        Optional<Integer> override = member.minIntervalOverride(slot.shiftType());
        if (override.isPresent()) {
            return override.get();
        }
        if (slot.shiftType() == ShiftType.NIGHT) {
            return rules.nightMinIntervalDays();
        }
        if (slot.index() == 3 && rules.dayIndex3MinIntervalDays() != null) {
            return rules.dayIndex3MinIntervalDays();
        }
        return rules.dayMinIntervalDays();
    }

    public Optional<Elimination> checkInterval(Member member, DutySlot slot, FairnessState state) {
        Optional<LocalDate> last = state.lastAssigned(member.name(), slot.shiftType());
        if (last.isEmpty()) {
            return Optional.empty();
        }
        long since = ChronoUnit.DAYS.between(last.get(), slot.date());
        int required = requiredInterval(member, slot);
        if (since < required) {
            return Optional.of(Elimination.of(EliminationReason.MIN_INTERVAL,
                    since + " day(s) since " + last.get() + ", " + required + " required"));
        }
        return Optional.empty();
    }

    @Override
    public Member select(DutySlot slot, List<Member> pool, FairnessState state) {
        return pool.stream()
                .min(Comparator.comparing(m -> score(m, slot, state)))
                .orElseThrow(() -> new IllegalStateException("Empty candidate pool for " + slot.label()));
    }
}
