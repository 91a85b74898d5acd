package com.example.dutyroster.history;

import com.example.dutyroster.calendar.DutySlot;
import com.example.dutyroster.calendar.ShiftType;
import com.example.dutyroster.member.Member;
import com.example.dutyroster.member.MemberRoster;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.example.dutyroster.member.IndexGroup.DAY_INDEX_1_2;
import static com.example.dutyroster.member.IndexGroup.DAY_INDEX_3;
import static com.example.dutyroster.member.IndexGroup.NIGHT_INDEX_1;
import static com.example.dutyroster.member.IndexGroup.NIGHT_INDEX_2;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EligibilityModelTest {

    private static final LocalDate START = LocalDate.of(2025, 3, 21);

    private final Member promoted = Member.of("Abe", DAY_INDEX_1_2, null);
    private final Member demoted = Member.of("Noda", DAY_INDEX_3, null);
    private final Member fresh = Member.of("Goto", DAY_INDEX_3, null);
    private final Member nightOne = Member.of("Kato", DAY_INDEX_1_2, NIGHT_INDEX_1);
    private final Member nightTwo = Member.of("Yano", null, NIGHT_INDEX_2);
    private final MemberRoster roster = MemberRoster.of(List.of(promoted, demoted, fresh, nightOne, nightTwo));

    @Test
    void latestDayRecordDecidesDayPositions() {
        HistoryWindow history = HistoryWindow.before(START, 2, List.of(
                new HistoryRecord(LocalDate.of(2025, 2, 1), ShiftType.DAY, 1, "Abe"),
                new HistoryRecord(LocalDate.of(2025, 3, 1), ShiftType.DAY, 3, "Abe"),
                new HistoryRecord(LocalDate.of(2025, 3, 8), ShiftType.DAY, 2, "Noda")));

        EligibilityModel model = EligibilityModel.build(roster, history);

        assertThat(model.eligibleIndices(promoted, ShiftType.DAY)).containsExactly(3);
        assertThat(model.eligibleIndices(demoted, ShiftType.DAY)).containsExactlyInAnyOrder(1, 2);
        assertThat(model.eligibleIndices(fresh, ShiftType.DAY)).containsExactly(3);
    }

    @Test
    void nightRecordsAreWindowedByTheMondayOfTheirWeek() {
        HistoryWindow history = HistoryWindow.before(START, 2, List.of(
                new HistoryRecord(LocalDate.of(2025, 1, 22), ShiftType.NIGHT, 2, "Yano"),
                new HistoryRecord(LocalDate.of(2025, 3, 21), ShiftType.NIGHT, 1, "Kato")));

        assertThat(history.records()).extracting(HistoryRecord::memberName).containsExactly("Kato");
        assertThat(history.nightWeeks("Kato")).containsExactly(LocalDate.of(2025, 3, 17));
        assertThat(history.nightWeeks("Yano")).isEmpty();
    }

    @Test
    void recordsOutsideTheLookbackWindowAreIgnored() {
        HistoryWindow history = HistoryWindow.before(START, 2, List.of(
                new HistoryRecord(LocalDate.of(2025, 1, 18), ShiftType.DAY, 3, "Abe"),
                new HistoryRecord(LocalDate.of(2025, 3, 22), ShiftType.DAY, 3, "Abe")));

        EligibilityModel model = EligibilityModel.build(roster, history);

        assertThat(history.records()).isEmpty();
        assertThat(model.eligibleIndices(promoted, ShiftType.DAY)).containsExactlyInAnyOrder(1, 2);
    }

    @Test
    void nightPositionsFollowTheStaticGroupOnly() {
        HistoryWindow history = HistoryWindow.before(START, 2, List.of(
                new HistoryRecord(LocalDate.of(2025, 3, 3), ShiftType.NIGHT, 2, "Kato")));

        EligibilityModel model = EligibilityModel.build(roster, history);

        assertThat(model.isEligible(nightOne, DutySlot.night(LocalDate.of(2025, 3, 24), 1))).isTrue();
        assertThat(model.isEligible(nightOne, DutySlot.night(LocalDate.of(2025, 3, 24), 2))).isFalse();
        assertThat(model.isEligible(nightTwo, DutySlot.night(LocalDate.of(2025, 3, 24), 2))).isTrue();
        assertThat(model.eligibleIndices(nightTwo, ShiftType.DAY)).isEmpty();
        assertThat(model.eligibleIndices(promoted, ShiftType.NIGHT)).isEmpty();
    }

    @Test
    void nightHistoryIsNormalisedToItsMonday() {
        HistoryRecord record = new HistoryRecord(LocalDate.of(2025, 3, 12), ShiftType.NIGHT, 1, "Kato");
        HistoryWindow history = HistoryWindow.before(START, 2, List.of(record));

        assertThat(record.dutyDate()).isEqualTo(LocalDate.of(2025, 3, 10));
        assertThat(history.lastDutyDate("Kato", ShiftType.NIGHT)).contains(LocalDate.of(2025, 3, 10));
        assertThat(history.nightWeeks("Kato")).containsExactly(LocalDate.of(2025, 3, 10));
        assertThat(history.count("Kato", ShiftType.NIGHT)).isEqualTo(1);
        assertThat(history.count("Kato", ShiftType.DAY)).isZero();
    }

    @Test
    void invalidHistoryRowsAreRejected() {
        assertThatThrownBy(() -> new HistoryRecord(null, ShiftType.DAY, 1, "Abe"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HistoryRecord(LocalDate.of(2025, 3, 1), ShiftType.NIGHT, 3, "Abe"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("NIGHT#3");
        assertThatThrownBy(() -> new HistoryRecord(LocalDate.of(2025, 3, 1), ShiftType.DAY, 0, "Abe"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HistoryRecord(LocalDate.of(2025, 3, 1), ShiftType.DAY, 1, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
