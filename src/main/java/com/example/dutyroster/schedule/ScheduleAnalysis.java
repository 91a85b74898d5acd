package com.example.dutyroster.schedule;

import java.time.LocalDate;
import java.util.List;

/**
 * Post-run review of a schedule: self-overlaps, tightly packed duties and per-member totals.
 */
public record ScheduleAnalysis(List<Overlap> overlaps,
                               List<CloseInterval> closeIntervals,
                               List<MemberCount> counts) {

    public ScheduleAnalysis {
        overlaps = List.copyOf(overlaps);
        closeIntervals = List.copyOf(closeIntervals);
        counts = List.copyOf(counts);
    }

    public boolean hasFindings() {
        return !overlaps.isEmpty() || !closeIntervals.isEmpty();
    }

    public record Overlap(String memberName, LocalDate dayDate, LocalDate nightWeekStart) {
    }

    /**
     * @param gapDays days from the end of the earlier duty to the start of the later one
     */
    public record CloseInterval(String memberName, String previous, String next, long gapDays) {
    }

    public record MemberCount(String memberName, int pastDay, int pastNight, int newDay, int newNight) {

        public int totalDay() {
            return pastDay + newDay;
        }

        public int totalNight() {
            return pastNight + newNight;
        }

        public int total() {
            return totalDay() + totalNight();
        }
    }
}
