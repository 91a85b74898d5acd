package com.example.dutyroster.schedule;

import com.example.dutyroster.calendar.DutySlot;
import com.example.dutyroster.calendar.RotationPeriod;
import com.example.dutyroster.calendar.ShiftType;
import com.example.dutyroster.exception.NoCandidateException;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one builder pass. Failed and aborted runs keep the assignments
 * committed before they stopped.
 *
 * @param failure  set only for {@link Status#FAILED}
 * @param nextSlot set only for {@link Status#ABORTED}
 */
public record ScheduleResult(Status status,
                             RotationPeriod period,
                             List<Assignment> assignments,
                             List<ScheduleNote> notes,
                             UnfilledSlot failure,
                             DutySlot nextSlot) {

    public enum Status {
        COMPLETED,
        FAILED,
        ABORTED
    }

    public ScheduleResult {
        assignments = List.copyOf(assignments);
        notes = List.copyOf(notes);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    public Optional<UnfilledSlot> failureDetail() {
        return Optional.ofNullable(failure);
    }

    public List<Assignment> assignmentsFor(String memberName) {
        return assignments.stream().filter(a -> a.memberName().equals(memberName)).toList();
    }

    public long count(ShiftType shiftType) {
        return assignments.stream().filter(a -> a.slot().shiftType() == shiftType).count();
    }

    public Optional<String> memberAt(DutySlot slot) {
        return assignments.stream().filter(a -> a.slot().equals(slot)).map(Assignment::memberName).findFirst();
    }

    /**
     * Returns this result unless the run stopped at an unfillable slot.
     *
     * @throws NoCandidateException carrying this result when the status is {@link Status#FAILED}
     */
    public ScheduleResult orElseThrow() {
        if (status == Status.FAILED) {
            throw new NoCandidateException(this);
        }
        return this;
    }
}
