package com.example.dutyroster.config;

/**
 * Immutable rule set for one generation run.
 *
 * @param dayMinIntervalDays        minimum days between two day shifts of the same member
 * @param nightMinIntervalDays      minimum days between two night week starts of the same member
 * @param dayIndex3MinIntervalDays  relaxed day interval for index 3, {@code null} to use the day default
 * @param nightToDayCooldownDays    a day shift must be at least this many days after a night week ends
 * @param lookbackMonths            size of the history window before the rotation start
 * @param maxSpanDays               longest accepted rotation period
 * @param fixedPatternCadenceDays   length of one period of the fixed pattern parity count
 */
public record RotationRules(int dayMinIntervalDays,
                            int nightMinIntervalDays,
                            Integer dayIndex3MinIntervalDays,
                            int nightToDayCooldownDays,
                            int lookbackMonths,
                            int maxSpanDays,
                            int fixedPatternCadenceDays) {

    public static final int DEFAULT_DAY_MIN_INTERVAL = 14;
    public static final int DEFAULT_NIGHT_MIN_INTERVAL = 21;
    public static final int DEFAULT_COOLDOWN = 7;
    public static final int DEFAULT_LOOKBACK_MONTHS = 2;
    public static final int DEFAULT_MAX_SPAN = 62;
    public static final int DEFAULT_CADENCE = 7;

    public RotationRules {
        requireNonNegative(dayMinIntervalDays, "dayMinIntervalDays");
        requireNonNegative(nightMinIntervalDays, "nightMinIntervalDays");
        requireNonNegative(nightToDayCooldownDays, "nightToDayCooldownDays");
        requireNonNegative(lookbackMonths, "lookbackMonths");
        if (dayIndex3MinIntervalDays != null) {
            requireNonNegative(dayIndex3MinIntervalDays, "dayIndex3MinIntervalDays");
        }
        if (maxSpanDays < 7) {
            throw new IllegalArgumentException("maxSpanDays must be at least 7");
        }
        if (fixedPatternCadenceDays <= 0) {
            throw new IllegalArgumentException("fixedPatternCadenceDays must be positive");
        }
    }

    public static RotationRules defaults() {
        return new RotationRules(DEFAULT_DAY_MIN_INTERVAL, DEFAULT_NIGHT_MIN_INTERVAL, null,
                DEFAULT_COOLDOWN, DEFAULT_LOOKBACK_MONTHS, DEFAULT_MAX_SPAN, DEFAULT_CADENCE);
    }

    public RotationRules withDayMinIntervalDays(int days) {
        return new RotationRules(days, nightMinIntervalDays, dayIndex3MinIntervalDays,
                nightToDayCooldownDays, lookbackMonths, maxSpanDays, fixedPatternCadenceDays);
    }

    public RotationRules withNightMinIntervalDays(int days) {
        return new RotationRules(dayMinIntervalDays, days, dayIndex3MinIntervalDays,
                nightToDayCooldownDays, lookbackMonths, maxSpanDays, fixedPatternCadenceDays);
    }

    public RotationRules withDayIndex3MinIntervalDays(Integer days) {
        return new RotationRules(dayMinIntervalDays, nightMinIntervalDays, days,
                nightToDayCooldownDays, lookbackMonths, maxSpanDays, fixedPatternCadenceDays);
    }

    public RotationRules withNightToDayCooldownDays(int days) {
        return new RotationRules(dayMinIntervalDays, nightMinIntervalDays, dayIndex3MinIntervalDays,
                days, lookbackMonths, maxSpanDays, fixedPatternCadenceDays);
    }

    public RotationRules withLookbackMonths(int months) {
        return new RotationRules(dayMinIntervalDays, nightMinIntervalDays, dayIndex3MinIntervalDays,
                nightToDayCooldownDays, months, maxSpanDays, fixedPatternCadenceDays);
    }

    private static void requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
    }
}
