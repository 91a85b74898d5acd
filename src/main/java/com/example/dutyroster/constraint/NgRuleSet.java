package com.example.dutyroster.constraint;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

public final class NgRuleSet {

    private static final NgRuleSet EMPTY = new NgRuleSet(List.of());

    private final List<NgRule> rules;
    private final Set<LocalDate> globalDates;

    private NgRuleSet(List<NgRule> rules) {
        this.rules = List.copyOf(rules);
        this.globalDates = this.rules.stream()
                .filter(NgRule::isGlobal)
                .flatMap(r -> r.start().datesUntil(r.end().plusDays(1)))
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public static NgRuleSet of(Collection<NgRule> rules) {
        return rules == null || rules.isEmpty() ? EMPTY : new NgRuleSet(List.copyOf(rules));
    }

    public static NgRuleSet empty() {
        return EMPTY;
    }

    public List<NgRule> rules() {
        return rules;
    }

    public Set<LocalDate> globalDates() {
        return globalDates;
    }

    public boolean isGlobalDate(LocalDate date) {
        return globalDates.contains(date);
    }

    public List<NgRule> forMember(String memberName) {
        return rules.stream().filter(r -> !r.isGlobal() && r.memberName().equals(memberName)).toList();
    }

    /**
     * Member names the rules refer to, for roster cross-checking.
     */
    public Set<String> referencedMembers() {
        return rules.stream()
                .filter(r -> !r.isGlobal())
                .map(NgRule::memberName)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
