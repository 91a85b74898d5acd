package com.example.dutyroster.schedule;

import java.time.LocalDate;

/**
 * Biweekly forced assignment of one member to one night position.
 *
 * @param referenceDate week start of a known forced week; {@code null} to take it from history
 * @param targetIndex   night index the member is forced into
 * @param cadenceDays   length of one parity step, {@code null} for the rule default
 */
public record FixedPatternSettings(String memberName,
                                   LocalDate referenceDate,
                                   int targetIndex,
                                   Integer cadenceDays,
                                   boolean enabled) {

    public static final int DEFAULT_TARGET_INDEX = 2;

    public FixedPatternSettings {
        if (memberName != null) {
            memberName = memberName.strip();
        }
    }

    public static FixedPatternSettings of(String memberName, LocalDate referenceDate) {
        return new FixedPatternSettings(memberName, referenceDate, DEFAULT_TARGET_INDEX, null, true);
    }

    public static FixedPatternSettings disabled() {
        return new FixedPatternSettings(null, null, DEFAULT_TARGET_INDEX, null, false);
    }
}
