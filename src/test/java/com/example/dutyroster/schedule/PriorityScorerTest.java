package com.example.dutyroster.schedule;

import com.example.dutyroster.calendar.DutySlot;
import com.example.dutyroster.calendar.ShiftType;
import com.example.dutyroster.config.RotationRules;
import com.example.dutyroster.constraint.EliminationReason;
import com.example.dutyroster.history.HistoryRecord;
import com.example.dutyroster.history.HistoryWindow;
import com.example.dutyroster.member.IndexGroup;
import com.example.dutyroster.member.Member;
import com.example.dutyroster.member.MemberRoster;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PriorityScorerTest {

    private static final LocalDate START = LocalDate.of(2025, 3, 21);

    private final Member abe = Member.of("Abe", IndexGroup.DAY_INDEX_1_2, null);
    private final Member baba = Member.of("Baba", IndexGroup.DAY_INDEX_1_2, null);
    private final Member chiba = Member.of("Chiba", IndexGroup.DAY_INDEX_1_2, null);
    private final Member doi = Member.of("Doi", IndexGroup.DAY_INDEX_3, IndexGroup.NIGHT_INDEX_1);
    private final MemberRoster roster = MemberRoster.of(List.of(abe, baba, chiba, doi));

    private final HistoryWindow history = HistoryWindow.before(START, 2, List.of(
            new HistoryRecord(LocalDate.of(2025, 2, 8), ShiftType.DAY, 1, "Abe"),
            new HistoryRecord(LocalDate.of(2025, 3, 1), ShiftType.DAY, 2, "Abe"),
            new HistoryRecord(LocalDate.of(2025, 2, 15), ShiftType.DAY, 1, "Baba"),
            new HistoryRecord(LocalDate.of(2025, 3, 8), ShiftType.DAY, 1, "Chiba"),
            new HistoryRecord(LocalDate.of(2025, 3, 15), ShiftType.DAY, 3, "Doi"),
            new HistoryRecord(LocalDate.of(2025, 3, 5), ShiftType.NIGHT, 1, "Doi")));

    private final PriorityScorer scorer = new PriorityScorer(RotationRules.defaults());

    @Test
    void fewerAssignmentsWinThenLongerGapThenName() {
        FairnessState state = FairnessState.seed(roster, history);
        DutySlot slot = DutySlot.day(LocalDate.of(2025, 3, 22), 1);

        assertThat(scorer.score(abe, slot, state)).isEqualTo(new PriorityKey(2, 21, "Abe"));
        assertThat(scorer.score(baba, slot, state)).isEqualTo(new PriorityKey(1, 35, "Baba"));
        assertThat(scorer.score(chiba, slot, state)).isEqualTo(new PriorityKey(1, 14, "Chiba"));
        assertThat(scorer.select(slot, List.of(abe, chiba, baba), state)).isEqualTo(baba);
    }

    @Test
    void neverAssignedBeatsAnyGapAndNameBreaksFullTies() {
        Member endo = Member.of("Endo", IndexGroup.DAY_INDEX_1_2, null);
        Member fujii = Member.of("Fujii", IndexGroup.DAY_INDEX_1_2, null);
        FairnessState state = FairnessState.seed(MemberRoster.of(List.of(fujii, endo)), HistoryWindow.empty(START));
        DutySlot slot = DutySlot.day(LocalDate.of(2025, 3, 22), 1);

        assertThat(scorer.score(endo, slot, state).gapDays()).isEqualTo(PriorityKey.NEVER_ASSIGNED);
        assertThat(scorer.select(slot, List.of(fujii, endo), state)).isEqualTo(endo);
        assertThat(new PriorityKey(1, PriorityKey.NEVER_ASSIGNED, "Zed")).isLessThan(new PriorityKey(1, 400, "Abe"));
    }

    @Test
    void committedAssignmentsUpdateCountAndGap() {
        FairnessState state = FairnessState.seed(roster, history);
        state.commit(new Assignment(DutySlot.day(LocalDate.of(2025, 3, 22), 1), "Baba", false));

        PriorityKey key = scorer.score(baba, DutySlot.day(LocalDate.of(2025, 4, 5), 1), state);

        assertThat(key).isEqualTo(new PriorityKey(2, 14, "Baba"));
        assertThat(state.runCount("Baba", ShiftType.DAY)).isEqualTo(1);
        assertThat(state.committedSlots("Baba")).hasSize(1);
    }

    @Test
    void intervalBelowMinimumEliminates() {
        FairnessState state = FairnessState.seed(roster, history);

        assertThat(scorer.checkInterval(chiba, DutySlot.day(LocalDate.of(2025, 3, 22), 1), state)).isEmpty();
        assertThat(scorer.checkInterval(doi, DutySlot.day(LocalDate.of(2025, 3, 22), 3), state))
                .hasValueSatisfying(e -> assertThat(e.reason()).isEqualTo(EliminationReason.MIN_INTERVAL));
        assertThat(scorer.checkInterval(doi, DutySlot.night(LocalDate.of(2025, 3, 17), 1), state)).isPresent();
        assertThat(scorer.checkInterval(doi, DutySlot.night(LocalDate.of(2025, 3, 24), 1), state)).isEmpty();
    }

    @Test
    void relaxedIndexThreeIntervalAndMemberOverrides() {
        PriorityScorer relaxed = new PriorityScorer(RotationRules.defaults().withDayIndex3MinIntervalDays(7));
        FairnessState state = FairnessState.seed(roster, history);
        Member strictChiba = chiba.withIntervals(28, null);

        assertThat(relaxed.checkInterval(doi, DutySlot.day(LocalDate.of(2025, 3, 22), 3), state)).isEmpty();
        assertThat(relaxed.requiredInterval(doi, DutySlot.day(LocalDate.of(2025, 3, 22), 1))).isEqualTo(14);
        assertThat(scorer.requiredInterval(strictChiba, DutySlot.day(LocalDate.of(2025, 3, 29), 1))).isEqualTo(28);
        assertThat(scorer.checkInterval(strictChiba, DutySlot.day(LocalDate.of(2025, 3, 29), 1), state)).isPresent();
        assertThat(scorer.checkInterval(chiba, DutySlot.day(LocalDate.of(2025, 3, 29), 1), state)).isEmpty();
    }
}
