package com.example.dutyroster.calendar;

/**
 * Duty shift kinds. Day shifts are single weekend days with three positions,
 * night shifts cover a Monday-to-Sunday week with two positions.
 */
public enum ShiftType {
    DAY(3, 0),
    NIGHT(2, 6);

    private final int positions;
    private final int spanDays;

    ShiftType(int positions, int spanDays) {
        this.positions = positions;
        this.spanDays = spanDays;
    }

    public int positions() {
        return positions;
    }

    /**
     * Number of days after the slot date that the duty still covers.
     */
    public int spanDays() {
        return spanDays;
    }

    public boolean isValidIndex(int index) {
        return index >= 1 && index <= positions;
    }
}
