package com.example.dutyroster.history;

import com.example.dutyroster.calendar.DutySlot;
import com.example.dutyroster.calendar.ShiftType;
import com.example.dutyroster.member.IndexGroup;
import com.example.dutyroster.member.Member;
import com.example.dutyroster.member.MemberRoster;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-member eligible positions, computed once per run.
 * <p>
 * Day positions follow recent evidence: the latest day record in the history
 * window decides between {1,2} and {3}; without one the static day group applies.
 * Night positions are fixed by the night group alone.
 */
public final class EligibilityModel {

    private final Map<String, Map<ShiftType, Set<Integer>>> table;

    private EligibilityModel(Map<String, Map<ShiftType, Set<Integer>>> table) {
        this.table = table;
    }

    public static EligibilityModel build(MemberRoster roster, HistoryWindow history) {
        Map<String, Map<ShiftType, Set<Integer>>> table = new HashMap<>();
        for (Member member : roster.members()) {
            Map<ShiftType, Set<Integer>> byShift = new EnumMap<>(ShiftType.class);
            byShift.put(ShiftType.DAY, dayIndices(member, history));
            byShift.put(ShiftType.NIGHT, member.groupFor(ShiftType.NIGHT)
                    .map(IndexGroup::indices)
                    .orElse(Set.of()));
            table.put(member.name(), Collections.unmodifiableMap(byShift));
        }
        return new EligibilityModel(table);
    }

    private static Set<Integer> dayIndices(Member member, HistoryWindow history) {
        Optional<IndexGroup> staticGroup = member.groupFor(ShiftType.DAY);
        if (staticGroup.isEmpty()) {
            return Set.of();
        }
        return history.latest(member.name(), ShiftType.DAY)
                .map(r -> IndexGroup.of(ShiftType.DAY, r.index()).indices())
                .orElse(staticGroup.get().indices());
    }

    public Set<Integer> eligibleIndices(Member member, ShiftType shiftType) {
        Map<ShiftType, Set<Integer>> byShift = table.get(member.name());
        return byShift == null ? Set.of() : byShift.getOrDefault(shiftType, Set.of());
    }

    public boolean isEligible(Member member, DutySlot slot) {
        return eligibleIndices(member, slot.shiftType()).contains(slot.index());
    }
}
