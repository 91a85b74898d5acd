package com.example.dutyroster.schedule;

import com.example.dutyroster.calendar.DutySlot;

/**
 * A committed slot binding. {@code fixed} marks assignments made by the fixed-pattern override.
 */
public record Assignment(DutySlot slot, String memberName, boolean fixed) {
}
