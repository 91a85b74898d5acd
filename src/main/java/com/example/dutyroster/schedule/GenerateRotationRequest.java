package com.example.dutyroster.schedule;

import com.example.dutyroster.calendar.RotationPeriod;
import com.example.dutyroster.calendar.ShiftType;
import com.example.dutyroster.config.RotationRules;
import com.example.dutyroster.constraint.NgRule;
import com.example.dutyroster.constraint.NgRuleSet;
import com.example.dutyroster.history.HistoryRecord;
import com.example.dutyroster.member.IndexGroup;
import com.example.dutyroster.member.Member;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /api/rotations/generate}.
 */
public record GenerateRotationRequest(
        @NotNull(message = "開始日は必須です") LocalDate startDate,
        LocalDate endDate,
        @NotEmpty(message = "メンバーを1人以上指定してください") List<@Valid MemberDto> members,
        List<@Valid HistoryDto> history,
        @Valid NgRulesDto ngRules,
        @Valid FixedPatternDto fixedPattern,
        @Valid RulesDto rules) {

    public record MemberDto(
            @NotBlank(message = "メンバー名は必須です") String name,
            Boolean active,
            IndexGroup dayGroup,
            IndexGroup nightGroup,
            @PositiveOrZero Integer minDayIntervalDays,
            @PositiveOrZero Integer minNightIntervalDays) {

        Member toMember() {
            return new Member(name, active == null || active, dayGroup, nightGroup,
                    minDayIntervalDays, minNightIntervalDays);
        }
    }

    public record HistoryDto(
            @NotNull LocalDate date,
            @NotNull ShiftType shiftType,
            @Min(1) @Max(3) int index,
            @NotBlank String memberName) {

        HistoryRecord toRecord() {
            return new HistoryRecord(date, shiftType, index, memberName);
        }
    }

    /**
     * @param byMember member name to entries of the form {@code yyyy-MM-dd} or {@code yyyy-MM-dd/yyyy-MM-dd}
     */
    public record NgRulesDto(
            Map<String, List<String>> byMember,
            List<LocalDate> global,
            Map<String, List<@Valid PeriodDto>> byPeriod) {

        NgRuleSet toRuleSet() {
            List<NgRule> rules = new ArrayList<>();
            if (byMember != null) {
                byMember.forEach((name, entries) -> nonNull(entries).forEach(e -> rules.add(NgRule.parseMemberEntry(name, e))));
            }
            if (global != null) {
                global.forEach(d -> rules.add(NgRule.global(d)));
            }
            if (byPeriod != null) {
                byPeriod.forEach((name, periods) -> nonNull(periods).forEach(p ->
                        rules.add(NgRule.memberPeriod(name, p.start(), p.end(), p.reason()))));
            }
            return NgRuleSet.of(rules);
        }

        private static <T> List<T> nonNull(List<T> list) {
            return list == null ? List.of() : list;
        }
    }

    public record PeriodDto(@NotNull LocalDate start, @NotNull LocalDate end, String reason) {
    }

    public record FixedPatternDto(
            @NotBlank String memberName,
            LocalDate referenceDate,
            @Min(1) @Max(2) Integer targetIndex,
            @Min(1) Integer cadenceDays,
            Boolean enabled) {

        FixedPatternSettings toSettings() {
            return new FixedPatternSettings(memberName, referenceDate,
                    targetIndex == null ? FixedPatternSettings.DEFAULT_TARGET_INDEX : targetIndex,
                    cadenceDays, enabled == null || enabled);
        }
    }

    /**
     * Per-run overrides of the configured rule defaults; unset fields keep the default.
     */
    public record RulesDto(
            @PositiveOrZero Integer dayMinIntervalDays,
            @PositiveOrZero Integer nightMinIntervalDays,
            @PositiveOrZero Integer dayIndex3MinIntervalDays,
            @PositiveOrZero Integer nightToDayCooldownDays,
            @PositiveOrZero Integer lookbackMonths) {

        RotationRules applyTo(RotationRules base) {
            RotationRules rules = base;
            if (dayMinIntervalDays != null) {
                rules = rules.withDayMinIntervalDays(dayMinIntervalDays);
            }
            if (nightMinIntervalDays != null) {
                rules = rules.withNightMinIntervalDays(nightMinIntervalDays);
            }
            if (dayIndex3MinIntervalDays != null) {
                rules = rules.withDayIndex3MinIntervalDays(dayIndex3MinIntervalDays);
            }
            if (nightToDayCooldownDays != null) {
                rules = rules.withNightToDayCooldownDays(nightToDayCooldownDays);
            }
            if (lookbackMonths != null) {
                rules = rules.withLookbackMonths(lookbackMonths);
            }
            return rules;
        }
    }

    public RotationInput toInput(RotationRules defaults) {
        return new RotationInput(
                RotationPeriod.of(startDate, endDate),
                members.stream().map(MemberDto::toMember).toList(),
                history == null ? List.of() : history.stream().map(HistoryDto::toRecord).toList(),
                ngRules == null ? NgRuleSet.empty() : ngRules.toRuleSet(),
                fixedPattern == null ? FixedPatternSettings.disabled() : fixedPattern.toSettings(),
                rules == null ? defaults : rules.applyTo(defaults));
    }
}
