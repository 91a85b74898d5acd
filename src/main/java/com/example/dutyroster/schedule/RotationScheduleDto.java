package com.example.dutyroster.schedule;

import com.example.dutyroster.calendar.DutySlot;
import com.example.dutyroster.calendar.ShiftType;
import com.example.dutyroster.constraint.Elimination;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record RotationScheduleDto(
        String status,
        LocalDate startDate,
        LocalDate endDate,
        List<AssignmentDto> assignments,
        List<NoteDto> notes,
        FailureDto failure,
        SlotDto nextSlot) {

    public record SlotDto(LocalDate date, ShiftType shiftType, int index) {
        static SlotDto from(DutySlot slot) {
            return slot == null ? null : new SlotDto(slot.date(), slot.shiftType(), slot.index());
        }
    }

    public record AssignmentDto(LocalDate date, ShiftType shiftType, int index, String memberName, boolean fixed) {
        static AssignmentDto from(Assignment a) {
            return new AssignmentDto(a.slot().date(), a.slot().shiftType(), a.slot().index(), a.memberName(), a.fixed());
        }
    }

    public record NoteDto(String type, LocalDate date, SlotDto slot, String message) {
        static NoteDto from(ScheduleNote note) {
            return new NoteDto(note.type().name(), note.date(), SlotDto.from(note.slot()), note.message());
        }
    }

    public record EliminationDto(String reason, String detail) {
        static EliminationDto from(Elimination e) {
            return new EliminationDto(e.reason().name(), e.detail());
        }
    }

    public record FailureDto(SlotDto slot, Map<String, List<EliminationDto>> eliminations) {
        static FailureDto from(UnfilledSlot unfilled) {
            if (unfilled == null) {
                return null;
            }
            Map<String, List<EliminationDto>> map = new LinkedHashMap<>();
            unfilled.eliminations().forEach((name, reasons) ->
                    map.put(name, reasons.stream().map(EliminationDto::from).toList()));
            return new FailureDto(SlotDto.from(unfilled.slot()), map);
        }
    }

    public static RotationScheduleDto from(ScheduleResult result) {
        return new RotationScheduleDto(
                result.status().name(),
                result.period().start(),
                result.period().end(),
                result.assignments().stream().map(AssignmentDto::from).toList(),
                result.notes().stream().map(NoteDto::from).toList(),
                FailureDto.from(result.failure()),
                SlotDto.from(result.nextSlot()));
    }
}
