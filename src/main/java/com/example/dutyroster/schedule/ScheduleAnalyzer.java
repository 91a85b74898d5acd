package com.example.dutyroster.schedule;

import com.example.dutyroster.calendar.ShiftType;
import com.example.dutyroster.history.HistoryRecord;
import com.example.dutyroster.history.HistoryWindow;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class ScheduleAnalyzer {

    static final int CLOSE_INTERVAL_DAYS = 7;

    public ScheduleAnalysis analyze(ScheduleResult result, HistoryWindow history) {
        Map<String, List<Duty>> timeline = new TreeMap<>();
        for (HistoryRecord record : history.records()) {
            LocalDate start = record.dutyDate();
            timeline.computeIfAbsent(record.memberName(), k -> new ArrayList<>())
                    .add(new Duty(record.shiftType(), start, start.plusDays(record.shiftType().spanDays()), true));
        }
        for (Assignment assignment : result.assignments()) {
            timeline.computeIfAbsent(assignment.memberName(), k -> new ArrayList<>())
                    .add(new Duty(assignment.slot().shiftType(), assignment.slot().spanStart(),
                            assignment.slot().spanEnd(), false));
        }

        List<ScheduleAnalysis.Overlap> overlaps = new ArrayList<>();
        List<ScheduleAnalysis.CloseInterval> close = new ArrayList<>();
        List<ScheduleAnalysis.MemberCount> counts = new ArrayList<>();
        timeline.forEach((name, duties) -> {
            duties.sort(Comparator.comparing(Duty::start).thenComparing(Duty::type));
            findOverlaps(name, duties, overlaps);
            findCloseIntervals(name, duties, close);
            ScheduleAnalysis.MemberCount count = count(name, duties);
            if (count.total() > 0) {
                counts.add(count);
            }
        });
        return new ScheduleAnalysis(overlaps, close, counts);
    }

    private void findOverlaps(String name, List<Duty> duties, List<ScheduleAnalysis.Overlap> out) {
        for (Duty night : duties) {
            if (night.type() != ShiftType.NIGHT) {
                continue;
            }
            for (Duty day : duties) {
                if (day.type() == ShiftType.DAY && !day.start().isBefore(night.start()) && !day.start().isAfter(night.end())) {
                    out.add(new ScheduleAnalysis.Overlap(name, day.start(), night.start()));
                }
            }
        }
    }

    private void findCloseIntervals(String name, List<Duty> duties, List<ScheduleAnalysis.CloseInterval> out) {
        for (int i = 1; i < duties.size(); i++) {
            Duty previous = duties.get(i - 1);
            Duty next = duties.get(i);
            long gap = ChronoUnit.DAYS.between(previous.end(), next.start());
            if (gap >= 1 && gap <= CLOSE_INTERVAL_DAYS) {
                out.add(new ScheduleAnalysis.CloseInterval(name, previous.label(), next.label(), gap));
            }
        }
    }

    private ScheduleAnalysis.MemberCount count(String name, List<Duty> duties) {
        int pastDay = 0;
        int pastNight = 0;
        int newDay = 0;
        int newNight = 0;
        for (Duty duty : duties) {
            boolean day = duty.type() == ShiftType.DAY;
            if (duty.past()) {
                if (day) pastDay++; else pastNight++;
            } else {
                if (day) newDay++; else newNight++;
            }
        }
        return new ScheduleAnalysis.MemberCount(name, pastDay, pastNight, newDay, newNight);
    }

    private record Duty(ShiftType type, LocalDate start, LocalDate end, boolean past) {
        String label() {
            return type == ShiftType.NIGHT ? type + " " + start + "~" + end : type + " " + start;
        }
    }
}
