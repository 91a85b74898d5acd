package com.example.dutyroster.schedule;

import com.example.dutyroster.calendar.DutySlot;
import com.example.dutyroster.calendar.ShiftType;
import com.example.dutyroster.history.HistoryWindow;
import com.example.dutyroster.member.Member;
import com.example.dutyroster.member.MemberRoster;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Running per-member counters for one pass, seeded from history.
 * Only {@link #commit(Assignment)} mutates it.
 */
public final class FairnessState {

    private final Map<String, Map<ShiftType, Counter>> counters = new HashMap<>();
    private final Map<String, List<DutySlot>> committed = new HashMap<>();

    private FairnessState() {
    }

    public static FairnessState seed(MemberRoster roster, HistoryWindow history) {
        FairnessState state = new FairnessState();
        for (Member member : roster.members()) {
            Map<ShiftType, Counter> byShift = new EnumMap<>(ShiftType.class);
            for (ShiftType type : ShiftType.values()) {
                Counter counter = new Counter();
                counter.historyCount = history.count(member.name(), type);
                counter.lastDate = history.lastDutyDate(member.name(), type).orElse(null);
                byShift.put(type, counter);
            }
            state.counters.put(member.name(), byShift);
            state.committed.put(member.name(), new ArrayList<>());
        }
        return state;
    }

    void commit(Assignment assignment) {
        DutySlot slot = assignment.slot();
        Counter counter = counter(assignment.memberName(), slot.shiftType());
        counter.runCount++;
        if (counter.lastDate == null || counter.lastDate.isBefore(slot.date())) {
            counter.lastDate = slot.date();
        }
        committed.get(assignment.memberName()).add(slot);
    }

    /**
     * History-seeded total for the shift type.
     */
    public int totalCount(String memberName, ShiftType shiftType) {
        Counter counter = counter(memberName, shiftType);
        return counter.historyCount + counter.runCount;
    }

    public int runCount(String memberName, ShiftType shiftType) {
        return counter(memberName, shiftType).runCount;
    }

    public Optional<LocalDate> lastAssigned(String memberName, ShiftType shiftType) {
        return Optional.ofNullable(counter(memberName, shiftType).lastDate);
    }

    public List<DutySlot> committedSlots(String memberName) {
        return List.copyOf(committed.getOrDefault(memberName, List.of()));
    }

    private Counter counter(String memberName, ShiftType shiftType) {
        Map<ShiftType, Counter> byShift = counters.get(memberName);
        if (byShift == null) {
            throw new IllegalArgumentException("Unknown member: " + memberName);
        }
        return byShift.get(shiftType);
    }

    private static final class Counter {
        private int historyCount;
        private int runCount;
        private LocalDate lastDate;
    }
}
