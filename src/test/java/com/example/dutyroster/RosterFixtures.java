package com.example.dutyroster;

import com.example.dutyroster.calendar.RotationPeriod;
import com.example.dutyroster.member.IndexGroup;
import com.example.dutyroster.member.Member;
import com.example.dutyroster.schedule.FixedPatternSettings;
import com.example.dutyroster.schedule.RotationInput;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.example.dutyroster.member.IndexGroup.DAY_INDEX_1_2;
import static com.example.dutyroster.member.IndexGroup.DAY_INDEX_3;
import static com.example.dutyroster.member.IndexGroup.NIGHT_INDEX_1;
import static com.example.dutyroster.member.IndexGroup.NIGHT_INDEX_2;

/**
 * Shared 22-member roster and the March 21 to May 20, 2025 rotation.
 * The fixed-pattern member works every other week, so it carries a 14-day night interval.
 */
public final class RosterFixtures {

    public static final LocalDate START = LocalDate.of(2025, 3, 21);
    public static final LocalDate END = LocalDate.of(2025, 5, 20);
    public static final RotationPeriod PERIOD = new RotationPeriod(START, END);

    public static final String FIXED_MEMBER = "Matsuda";
    public static final LocalDate FIXED_REFERENCE = LocalDate.of(2025, 3, 24);

    public static final List<String> DAY_12_ONLY = List.of(
            "Abe", "Baba", "Chiba", "Doi", "Endo", "Fujii", "Goto", "Hara", "Ikeda", "Jinno");
    public static final List<String> DAY_3_ONLY = List.of("Noda", "Ono", "Ozeki", "Sato");
    public static final List<String> NIGHT_1_ONLY = List.of("Ueda", "Wada");
    public static final List<String> NIGHT_2_ONLY = List.of("Matsuda", "Yano", "Yoshida");

    private RosterFixtures() {
    }

    public static List<Member> roster() {
        List<Member> members = new ArrayList<>();
        DAY_12_ONLY.forEach(n -> members.add(Member.of(n, DAY_INDEX_1_2, null)));
        members.add(Member.of("Kato", DAY_INDEX_1_2, NIGHT_INDEX_1));
        members.add(Member.of("Maruoka", DAY_INDEX_1_2, NIGHT_INDEX_1));
        DAY_3_ONLY.forEach(n -> members.add(Member.of(n, DAY_INDEX_3, null)));
        members.add(Member.of("Tani", DAY_INDEX_3, NIGHT_INDEX_2));
        NIGHT_1_ONLY.forEach(n -> members.add(Member.of(n, null, NIGHT_INDEX_1)));
        NIGHT_2_ONLY.forEach(n -> members.add(n.equals(FIXED_MEMBER)
                ? Member.of(n, null, NIGHT_INDEX_2).withIntervals(null, 14)
                : Member.of(n, null, NIGHT_INDEX_2)));
        return members;
    }

    public static FixedPatternSettings fixedPattern() {
        return FixedPatternSettings.of(FIXED_MEMBER, FIXED_REFERENCE);
    }

    public static RotationInput scenarioA() {
        return RotationInput.of(PERIOD, roster()).withFixedPattern(fixedPattern());
    }

    public static Member member(String name) {
        return roster().stream().filter(m -> m.name().equals(name)).findFirst().orElseThrow();
    }

    public static List<String> groupMembers(IndexGroup group) {
        return roster().stream()
                .filter(m -> m.groupFor(group.shiftType()).filter(g -> g == group).isPresent())
                .map(Member::name)
                .toList();
    }
}
