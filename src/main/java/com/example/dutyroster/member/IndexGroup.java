package com.example.dutyroster.member;

import com.example.dutyroster.calendar.ShiftType;

import java.util.Set;

/**
 * Static position category of a member within one shift type.
 */
public enum IndexGroup {
    DAY_INDEX_1_2(ShiftType.DAY, Set.of(1, 2)),
    DAY_INDEX_3(ShiftType.DAY, Set.of(3)),
    NIGHT_INDEX_1(ShiftType.NIGHT, Set.of(1)),
    NIGHT_INDEX_2(ShiftType.NIGHT, Set.of(2));

    private final ShiftType shiftType;
    private final Set<Integer> indices;

    IndexGroup(ShiftType shiftType, Set<Integer> indices) {
        this.shiftType = shiftType;
        this.indices = indices;
    }

    public ShiftType shiftType() {
        return shiftType;
    }

    public Set<Integer> indices() {
        return indices;
    }

    /**
     * The group a historical position belongs to, e.g. day index 2 maps to {@link #DAY_INDEX_1_2}.
     */
    public static IndexGroup of(ShiftType shiftType, int index) {
        for (IndexGroup group : values()) {
            if (group.shiftType == shiftType && group.indices.contains(index)) {
                return group;
            }
        }
        throw new IllegalArgumentException("No index group for " + shiftType + " index " + index);
    }
}
