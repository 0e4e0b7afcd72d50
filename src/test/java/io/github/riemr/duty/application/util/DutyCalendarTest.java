package io.github.riemr.duty.application.util;

import io.github.riemr.duty.domain.model.TimeSlot;
import io.github.riemr.duty.domain.model.WeeklyTimeRule;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DutyCalendarTest {

    private final DutyCalendar calendar = new DutyCalendar();

    @Test
    void dayOfWeek_isIsoMondayOne() {
        assertThat(calendar.dayOfWeek(LocalDate.of(2024, 1, 1))).isEqualTo(1); // Monday
        assertThat(calendar.dayOfWeek(LocalDate.of(2024, 1, 7))).isEqualTo(7); // Sunday
    }

    @Test
    void sameWeek_usesIsoWeekAcrossYearBoundary() {
        // 2024-12-30 (Mon) と 2025-01-05 (Sun) は ISO 2025-W01
        assertThat(calendar.isSameWeek(LocalDate.of(2024, 12, 30), LocalDate.of(2025, 1, 5))).isTrue();
        // 日曜と翌月曜は別の週
        assertThat(calendar.isSameWeek(LocalDate.of(2024, 1, 7), LocalDate.of(2024, 1, 8))).isFalse();
        // 同じ週番号でも年が違えば別
        assertThat(calendar.isSameWeek(LocalDate.of(2023, 1, 2), LocalDate.of(2024, 1, 1))).isFalse();
    }

    @Test
    void sameMonth_comparesYearAndMonth() {
        assertThat(calendar.isSameMonth(LocalDate.of(2024, 1, 31), LocalDate.of(2024, 1, 1))).isTrue();
        assertThat(calendar.isSameMonth(LocalDate.of(2024, 1, 31), LocalDate.of(2024, 2, 1))).isFalse();
        assertThat(calendar.isSameMonth(LocalDate.of(2023, 3, 1), LocalDate.of(2024, 3, 1))).isFalse();
    }

    @Test
    void timeInRange_isStartInclusiveEndExclusive() {
        LocalTime six = LocalTime.of(6, 0);
        LocalTime nine = LocalTime.of(9, 0);
        assertThat(calendar.isTimeInRange(six, six, nine)).isTrue();
        assertThat(calendar.isTimeInRange(LocalTime.of(8, 59), six, nine)).isTrue();
        assertThat(calendar.isTimeInRange(nine, six, nine)).isFalse();
        assertThat(calendar.isTimeInRange(LocalTime.of(5, 59), six, nine)).isFalse();
    }

    @Test
    void timeInRange_wrapsPastMidnight() {
        LocalTime start = LocalTime.of(22, 0);
        LocalTime end = LocalTime.of(6, 0);
        assertThat(calendar.isTimeInRange(LocalTime.of(23, 30), start, end)).isTrue();
        assertThat(calendar.isTimeInRange(LocalTime.of(2, 0), start, end)).isTrue();
        assertThat(calendar.isTimeInRange(LocalTime.of(6, 0), start, end)).isFalse();
        assertThat(calendar.isTimeInRange(LocalTime.of(12, 0), start, end)).isFalse();
    }

    @Test
    void timeInRange_emptySlotNeverMatches() {
        LocalTime t = LocalTime.of(7, 0);
        assertThat(calendar.isTimeInRange(t, t, t)).isFalse();
    }

    @Test
    void matchesAny_onlyConsidersRulesForThatWeekday() {
        List<WeeklyTimeRule> rules = List.of(WeeklyTimeRule.of(1, TimeSlot.of("06:00", "09:00")));
        LocalDate monday = LocalDate.of(2024, 1, 1);
        LocalTime seven = LocalTime.of(7, 0);
        assertThat(calendar.matchesAny(rules, monday, seven)).isTrue();
        assertThat(calendar.matchesAny(rules, monday.plusDays(1), seven)).isFalse();
        assertThat(calendar.matchesAny(List.of(), monday, seven)).isFalse();
        assertThat(calendar.matchesAny(null, monday, seven)).isFalse();
    }

    @Test
    void parseStartTime_acceptsRangesAndSingleDigitHours() {
        assertThat(DutyCalendar.parseStartTime("07:00")).isEqualTo(LocalTime.of(7, 0));
        assertThat(DutyCalendar.parseStartTime("7:30")).isEqualTo(LocalTime.of(7, 30));
        assertThat(DutyCalendar.parseStartTime("18:00-20:00")).isEqualTo(LocalTime.of(18, 0));
    }

    @Test
    void parseStartTime_rejectsGarbage() {
        assertThatThrownBy(() -> DutyCalendar.parseStartTime("seven")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DutyCalendar.parseStartTime(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DutyCalendar.parseStartTime("25:00")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void format_isIsoLocalDate() {
        assertThat(DutyCalendar.format(LocalDate.of(2024, 3, 5))).isEqualTo("2024-03-05");
        assertThat(DutyCalendar.parseDate(" 2024-03-05 ")).isEqualTo(LocalDate.of(2024, 3, 5));
    }
}
