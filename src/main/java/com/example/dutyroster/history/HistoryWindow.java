package com.example.dutyroster.history;

import com.example.dutyroster.calendar.ShiftType;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Read-only view of the assignments made in the months before a rotation starts.
 * Records whose duty date (the Monday for night weeks) falls outside
 * {@code [from, until)} are dropped on construction.
 */
public final class HistoryWindow {

    private static final Comparator<HistoryRecord> CHRONOLOGICAL = Comparator
            .comparing(HistoryRecord::dutyDate)
            .thenComparing(HistoryRecord::shiftType)
            .thenComparingInt(HistoryRecord::index)
            .thenComparing(HistoryRecord::memberName);

    private final LocalDate from;
    private final LocalDate until;
    private final List<HistoryRecord> records;

    private HistoryWindow(LocalDate from, LocalDate until, List<HistoryRecord> records) {
        this.from = from;
        this.until = until;
        this.records = records;
    }

    public static HistoryWindow before(LocalDate rotationStart, int lookbackMonths, Collection<HistoryRecord> all) {
        LocalDate from = rotationStart.minusMonths(lookbackMonths);
        List<HistoryRecord> kept = all.stream()
                .filter(r -> !r.dutyDate().isBefore(from) && r.dutyDate().isBefore(rotationStart))
                .sorted(CHRONOLOGICAL)
                .toList();
        return new HistoryWindow(from, rotationStart, kept);
    }

    public static HistoryWindow empty(LocalDate rotationStart) {
        return new HistoryWindow(rotationStart, rotationStart, List.of());
    }

    public LocalDate from() {
        return from;
    }

    public LocalDate until() {
        return until;
    }

    public List<HistoryRecord> records() {
        return records;
    }

    public List<HistoryRecord> recordsFor(String memberName, ShiftType shiftType) {
        return records.stream()
                .filter(r -> r.memberName().equals(memberName) && r.shiftType() == shiftType)
                .toList();
    }

    public int count(String memberName, ShiftType shiftType) {
        return recordsFor(memberName, shiftType).size();
    }

    public Optional<LocalDate> lastDutyDate(String memberName, ShiftType shiftType) {
        return latest(memberName, shiftType).map(HistoryRecord::dutyDate);
    }

    public Optional<HistoryRecord> latest(String memberName, ShiftType shiftType) {
        List<HistoryRecord> own = recordsFor(memberName, shiftType);
        return own.isEmpty() ? Optional.empty() : Optional.of(own.get(own.size() - 1));
    }

    /**
     * Mondays of the night weeks the member worked inside the window.
     */
    public Set<LocalDate> nightWeeks(String memberName) {
        return recordsFor(memberName, ShiftType.NIGHT).stream()
                .map(HistoryRecord::dutyDate)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public Optional<LocalDate> lastWeekAt(String memberName, int nightIndex) {
        return recordsFor(memberName, ShiftType.NIGHT).stream()
                .filter(r -> r.index() == nightIndex)
                .map(HistoryRecord::dutyDate)
                .max(Comparator.naturalOrder());
    }

    public Set<String> memberNames() {
        return records.stream().map(HistoryRecord::memberName).collect(Collectors.toCollection(TreeSet::new));
    }
}
