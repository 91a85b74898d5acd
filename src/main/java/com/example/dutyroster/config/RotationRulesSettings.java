package com.example.dutyroster.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Rule defaults from {@code duty.rules.*}. Each run receives its own immutable
 * {@link RotationRules} built from these values plus any per-request overrides.
 */
@Component
public class RotationRulesSettings {
    private final int dayMinIntervalDays;
    private final int nightMinIntervalDays;
    private final Integer dayIndex3MinIntervalDays;
    private final int nightToDayCooldownDays;
    private final int lookbackMonths;
    private final int maxSpanDays;
    private final int fixedPatternCadenceDays;

    public RotationRulesSettings(
            @Value("${duty.rules.day.min-interval-days:14}") int dayMinIntervalDays,
            @Value("${duty.rules.night.min-interval-days:21}") int nightMinIntervalDays,
            @Value("${duty.rules.day.index3-min-interval-days:#{null}}") Integer dayIndex3MinIntervalDays,
            @Value("${duty.rules.night-to-day-cooldown-days:7}") int nightToDayCooldownDays,
            @Value("${duty.rules.history.lookback-months:2}") int lookbackMonths,
            @Value("${duty.rules.rotation.max-span-days:62}") int maxSpanDays,
            @Value("${duty.rules.fixed-pattern.cadence-days:7}") int fixedPatternCadenceDays) {
        this.dayMinIntervalDays = dayMinIntervalDays;
        this.nightMinIntervalDays = nightMinIntervalDays;
        this.dayIndex3MinIntervalDays = dayIndex3MinIntervalDays;
        this.nightToDayCooldownDays = nightToDayCooldownDays;
        this.lookbackMonths = lookbackMonths;
        this.maxSpanDays = maxSpanDays;
        this.fixedPatternCadenceDays = fixedPatternCadenceDays;
    }

    public RotationRules toRules() {
        return new RotationRules(dayMinIntervalDays, nightMinIntervalDays, dayIndex3MinIntervalDays,
                nightToDayCooldownDays, lookbackMonths, maxSpanDays, fixedPatternCadenceDays);
    }

    public int getDayMinIntervalDays() { return dayMinIntervalDays; }
    public int getNightMinIntervalDays() { return nightMinIntervalDays; }
    public Integer getDayIndex3MinIntervalDays() { return dayIndex3MinIntervalDays; }
    public int getNightToDayCooldownDays() { return nightToDayCooldownDays; }
    public int getLookbackMonths() { return lookbackMonths; }
    public int getMaxSpanDays() { return maxSpanDays; }
    public int getFixedPatternCadenceDays() { return fixedPatternCadenceDays; }
}
