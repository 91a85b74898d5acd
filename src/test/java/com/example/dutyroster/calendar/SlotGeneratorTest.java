package com.example.dutyroster.calendar;

import com.example.dutyroster.config.RotationRules;
import com.example.dutyroster.exception.InvalidPeriodException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlotGeneratorTest {

    private final SlotGenerator generator = new SlotGenerator(RotationRules.defaults());

    @Test
    void impliedPeriodEndsOnTheTwentiethTwoMonthsLater() {
        RotationPeriod period = RotationPeriod.implied(LocalDate.of(2025, 3, 21));

        assertThat(period.end()).isEqualTo(LocalDate.of(2025, 5, 20));
        assertThat(period.lengthInDays()).isEqualTo(61);
        assertThat(RotationPeriod.of(LocalDate.of(2025, 3, 21), null)).isEqualTo(period);
    }

    @Test
    void generate_producesWeekendTriplesAndMondayPairsInDateOrder() {
        SlotPlan plan = generator.generate(RotationPeriod.implied(LocalDate.of(2025, 3, 21)));

        assertThat(plan.count(ShiftType.DAY)).isEqualTo(18 * 3);
        assertThat(plan.count(ShiftType.NIGHT)).isEqualTo(9 * 2);
        assertThat(plan.slots()).isSorted();
        assertThat(plan.slots().subList(0, 4)).containsExactly(
                DutySlot.day(LocalDate.of(2025, 3, 22), 1),
                DutySlot.day(LocalDate.of(2025, 3, 22), 2),
                DutySlot.day(LocalDate.of(2025, 3, 22), 3),
                DutySlot.day(LocalDate.of(2025, 3, 23), 1));
        assertThat(plan.slots().get(plan.slots().size() - 1)).isEqualTo(DutySlot.night(LocalDate.of(2025, 5, 19), 2));
        assertThat(plan.skippedDayDates()).isEmpty();
    }

    @Test
    void generate_lastMondayAnchorsAWeekRunningPastTheEnd() {
        SlotPlan plan = generator.generate(new RotationPeriod(LocalDate.of(2025, 3, 21), LocalDate.of(2025, 3, 31)));

        List<DutySlot> nights = plan.slots().stream().filter(s -> s.shiftType() == ShiftType.NIGHT).toList();
        assertThat(nights).extracting(DutySlot::date)
                .containsExactly(LocalDate.of(2025, 3, 24), LocalDate.of(2025, 3, 24),
                        LocalDate.of(2025, 3, 31), LocalDate.of(2025, 3, 31));
        assertThat(nights.get(3).spanEnd()).isEqualTo(LocalDate.of(2025, 4, 6));
    }

    @Test
    void generate_skipsHolidayWeekendDaysAndFullyClosedWeeks() {
        Set<LocalDate> holidays = Set.of(
                LocalDate.of(2025, 4, 28), LocalDate.of(2025, 4, 29), LocalDate.of(2025, 4, 30),
                LocalDate.of(2025, 5, 1), LocalDate.of(2025, 5, 2),
                LocalDate.of(2025, 5, 3), LocalDate.of(2025, 5, 4));

        SlotPlan plan = generator.generate(RotationPeriod.implied(LocalDate.of(2025, 3, 21)), holidays);

        assertThat(plan.count(ShiftType.DAY)).isEqualTo(16 * 3);
        assertThat(plan.count(ShiftType.NIGHT)).isEqualTo(8 * 2);
        assertThat(plan.skippedDayDates()).containsExactly(LocalDate.of(2025, 5, 3), LocalDate.of(2025, 5, 4));
        assertThat(plan.skippedNightWeeks()).containsExactly(LocalDate.of(2025, 4, 28));
    }

    @Test
    void generate_keepsNightWeekWithASingleWorkingDay() {
        Set<LocalDate> holidays = Set.of(LocalDate.of(2025, 4, 28), LocalDate.of(2025, 4, 29));

        SlotPlan plan = generator.generate(RotationPeriod.implied(LocalDate.of(2025, 3, 21)), holidays);

        assertThat(plan.skippedNightWeeks()).isEmpty();
        assertThat(plan.count(ShiftType.NIGHT)).isEqualTo(18);
    }

    @Test
    void generate_rejectsMalformedPeriods() {
        assertThatThrownBy(() -> generator.generate(new RotationPeriod(LocalDate.of(2025, 5, 20), LocalDate.of(2025, 3, 21))))
                .isInstanceOf(InvalidPeriodException.class)
                .hasMessageContaining("precedes");
        assertThatThrownBy(() -> generator.generate(new RotationPeriod(LocalDate.of(2025, 3, 21), LocalDate.of(2025, 3, 26))))
                .isInstanceOf(InvalidPeriodException.class)
                .hasMessageContaining("at least one full week");
        assertThatThrownBy(() -> generator.generate(new RotationPeriod(LocalDate.of(2025, 3, 21), LocalDate.of(2025, 5, 22))))
                .isInstanceOf(InvalidPeriodException.class)
                .hasMessageContaining("at most 62");
        assertThatThrownBy(() -> generator.generate(RotationPeriod.implied(null)))
                .isInstanceOf(InvalidPeriodException.class)
                .extracting("errorCode").isEqualTo("INVALID_PERIOD");
    }

    @Test
    void dutySlot_rejectsPositionsOutsideTheWeeklyPattern() {
        assertThatThrownBy(() -> DutySlot.day(LocalDate.of(2025, 3, 24), 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DutySlot.night(LocalDate.of(2025, 3, 25), 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DutySlot.night(LocalDate.of(2025, 3, 24), 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nightSlotOverlapsWeekendDaysOfItsWeek() {
        DutySlot night = DutySlot.night(LocalDate.of(2025, 3, 24), 1);

        assertThat(night.overlaps(DutySlot.day(LocalDate.of(2025, 3, 29), 1))).isTrue();
        assertThat(night.overlaps(DutySlot.day(LocalDate.of(2025, 3, 30), 3))).isTrue();
        assertThat(night.overlaps(DutySlot.day(LocalDate.of(2025, 3, 23), 1))).isFalse();
        assertThat(night.label()).isEqualTo("2025-03-24 NIGHT#1");
    }
}
