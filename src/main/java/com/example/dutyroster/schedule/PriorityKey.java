package com.example.dutyroster.schedule;

import java.util.Comparator;

/**
 * Candidate ordering, lowest first: fewer assignments, then the longest gap since
 * the last assignment, then the member name.
 *
 * @param gapDays {@link Long#MAX_VALUE} for a member never assigned this shift type
 */
public record PriorityKey(int count, long gapDays, String memberName) implements Comparable<PriorityKey> {

    public static final long NEVER_ASSIGNED = Long.MAX_VALUE;

    private static final Comparator<PriorityKey> ORDER = Comparator
            .comparingInt(PriorityKey::count)
            .thenComparing(PriorityKey::gapDays, Comparator.reverseOrder())
            .thenComparing(PriorityKey::memberName);

    @Override
    public int compareTo(PriorityKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return memberName + "[count=" + count + ", gap=" + (gapDays == NEVER_ASSIGNED ? "-" : gapDays) + "]";
    }
}
