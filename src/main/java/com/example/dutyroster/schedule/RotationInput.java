package com.example.dutyroster.schedule;

import com.example.dutyroster.calendar.RotationPeriod;
import com.example.dutyroster.config.RotationRules;
import com.example.dutyroster.constraint.NgRuleSet;
import com.example.dutyroster.history.HistoryRecord;
import com.example.dutyroster.member.Member;

import java.util.List;

/**
 * Everything one generation run depends on.
 */
public record RotationInput(RotationPeriod period,
                            List<Member> members,
                            List<HistoryRecord> history,
                            NgRuleSet ngRules,
                            FixedPatternSettings fixedPattern,
                            RotationRules rules) {

    public RotationInput {
        members = members == null ? List.of() : List.copyOf(members);
        history = history == null ? List.of() : List.copyOf(history);
        ngRules = ngRules == null ? NgRuleSet.empty() : ngRules;
        fixedPattern = fixedPattern == null ? FixedPatternSettings.disabled() : fixedPattern;
        rules = rules == null ? RotationRules.defaults() : rules;
    }

    public static RotationInput of(RotationPeriod period, List<Member> members) {
        return new RotationInput(period, members, null, null, null, null);
    }

    public RotationInput withHistory(List<HistoryRecord> records) {
        return new RotationInput(period, members, records, ngRules, fixedPattern, rules);
    }

    public RotationInput withNgRules(NgRuleSet set) {
        return new RotationInput(period, members, history, set, fixedPattern, rules);
    }

    public RotationInput withFixedPattern(FixedPatternSettings settings) {
        return new RotationInput(period, members, history, ngRules, settings, rules);
    }

    public RotationInput withRules(RotationRules value) {
        return new RotationInput(period, members, history, ngRules, fixedPattern, value);
    }
}
