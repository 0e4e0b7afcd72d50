package io.github.riemr.duty.optimization.strategy;

import io.github.riemr.duty.application.dto.AssignmentRequest;
import io.github.riemr.duty.application.util.DutyCalendar;
import io.github.riemr.duty.application.util.HolidayCalendar;
import io.github.riemr.duty.application.util.SwedishHolidayCalendar;
import io.github.riemr.duty.domain.model.DutyAssignment;
import io.github.riemr.duty.domain.model.MemberAvailability;
import io.github.riemr.duty.domain.model.MemberForAssignment;
import io.github.riemr.duty.domain.model.MemberLimits;
import io.github.riemr.duty.domain.model.TimeSlot;
import io.github.riemr.duty.domain.model.WeeklyTimeRule;
import io.github.riemr.duty.optimization.config.LegacyScoring;
import io.github.riemr.duty.optimization.config.TieBreakPolicy;
import io.github.riemr.duty.optimization.filter.AvailabilityFilter;
import io.github.riemr.duty.optimization.filter.LimitFilter;
import io.github.riemr.duty.optimization.score.FairnessScorer;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GreedyFairnessSchedulerTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 1, 1);
    private static final LocalTime SEVEN = LocalTime.of(7, 0);

    private final DutyCalendar calendar = new DutyCalendar();

    private GreedyFairnessScheduler scheduler(HolidayCalendar holidays) {
        return new GreedyFairnessScheduler(calendar, new AvailabilityFilter(calendar), new LimitFilter(),
                new FairnessScorer(calendar), holidays);
    }

    private static AssignmentRequest request(List<LocalDate> dates, List<MemberForAssignment> members) {
        return AssignmentRequest.builder()
                .dates(dates)
                .members(members)
                .scheduledStartTime(SEVEN)
                .pointsValue(10)
                .build();
    }

    private static Map<LocalDate, String> byDate(List<DutyAssignment> assignments) {
        return assignments.stream().collect(Collectors.toMap(DutyAssignment::date, DutyAssignment::memberId));
    }

    @Test
    void skipsUnavailableAndCappedMembers() {
        MemberForAssignment a = MemberForAssignment.builder().memberId("A").historicalPoints(10).build();
        MemberForAssignment b = MemberForAssignment.builder()
                .memberId("B")
                .historicalPoints(5)
                .availability(MemberAvailability.builder()
                        .neverAvailable(List.of(WeeklyTimeRule.of(1, TimeSlot.of("06:00", "09:00"))))
                        .build())
                .build();
        MemberForAssignment c = MemberForAssignment.builder()
                .memberId("C")
                .historicalPoints(5)
                .limits(MemberLimits.builder().maxShiftsPerWeek(1).build())
                .build();

        List<DutyAssignment> result = scheduler(HolidayCalendar.none())
                .schedule(request(List.of(MONDAY, MONDAY.plusDays(1)), List.of(a, b, c)), LegacyScoring.defaults());

        assertThat(result).extracting(DutyAssignment::memberId).containsExactly("C", "B");
        assertThat(result).extracting(DutyAssignment::date).containsExactly(MONDAY, MONDAY.plusDays(1));
        assertThat(result).allSatisfy(r -> assertThat(r.pointsAwarded()).isEqualTo(10.0));
    }

    @Test
    void emptyRosterYieldsEmptyResult() {
        List<LocalDate> dates = List.of(MONDAY, MONDAY.plusDays(1), MONDAY.plusDays(2), MONDAY.plusDays(3), MONDAY.plusDays(4));
        assertThat(scheduler(HolidayCalendar.none()).schedule(request(dates, List.of()), LegacyScoring.defaults()))
                .isEmpty();
    }

    @Test
    void dateWithNoEligibleMemberIsLeftOut() {
        MemberForAssignment b = MemberForAssignment.builder()
                .memberId("B")
                .availability(MemberAvailability.builder()
                        .neverAvailable(List.of(WeeklyTimeRule.of(1, TimeSlot.of("06:00", "09:00"))))
                        .build())
                .build();

        List<DutyAssignment> result = scheduler(HolidayCalendar.none())
                .schedule(request(List.of(MONDAY, MONDAY.plusDays(1)), List.of(b)), LegacyScoring.defaults());

        assertThat(byDate(result)).containsOnlyKeys(MONDAY.plusDays(1));
    }

    @Test
    void weeklyCounterResetsOnNewIsoWeek() {
        MemberForAssignment c = MemberForAssignment.builder()
                .memberId("C")
                .limits(MemberLimits.builder().maxShiftsPerWeek(1).build())
                .build();
        List<LocalDate> dates = List.of(MONDAY, MONDAY.plusDays(1), MONDAY.plusDays(7));

        List<DutyAssignment> result = scheduler(HolidayCalendar.none())
                .schedule(request(dates, List.of(c)), LegacyScoring.defaults());

        assertThat(result).extracting(DutyAssignment::date).containsExactly(MONDAY, MONDAY.plusDays(7));
    }

    @Test
    void monthlyCounterResetsOnNewMonth() {
        MemberForAssignment c = MemberForAssignment.builder()
                .memberId("C")
                .limits(MemberLimits.builder().maxShiftsPerMonth(1).build())
                .build();
        List<LocalDate> dates = List.of(LocalDate.of(2024, 1, 30), LocalDate.of(2024, 1, 31), LocalDate.of(2024, 2, 1));

        List<DutyAssignment> result = scheduler(HolidayCalendar.none())
                .schedule(request(dates, List.of(c)), LegacyScoring.defaults());

        assertThat(result).extracting(DutyAssignment::date)
                .containsExactly(LocalDate.of(2024, 1, 30), LocalDate.of(2024, 2, 1));
    }

    @Test
    void preferenceBonusCanOutweighHistoricalPoints() {
        MemberForAssignment a = MemberForAssignment.builder()
                .memberId("A")
                .historicalPoints(5)
                .availability(MemberAvailability.builder()
                        .preferredTimes(List.of(WeeklyTimeRule.of(1, TimeSlot.of("07:00", "08:00"))))
                        .build())
                .build();
        MemberForAssignment b = MemberForAssignment.builder().memberId("B").historicalPoints(4).build();

        List<DutyAssignment> result = scheduler(HolidayCalendar.none())
                .schedule(request(List.of(MONDAY), List.of(b, a)), LegacyScoring.defaults());
        assertThat(result).extracting(DutyAssignment::memberId).containsExactly("A");

        List<DutyAssignment> noBonus = scheduler(HolidayCalendar.none())
                .schedule(request(List.of(MONDAY), List.of(b, a)), new LegacyScoring(0, 1.0, TieBreakPolicy.INPUT_ORDER));
        assertThat(noBonus).extracting(DutyAssignment::memberId).containsExactly("B");
    }

    @Test
    void tiesGoToFirstMemberInInputOrder() {
        MemberForAssignment x = MemberForAssignment.builder().memberId("x").build();
        MemberForAssignment a = MemberForAssignment.builder().memberId("a").build();
        List<LocalDate> dates = List.of(MONDAY, MONDAY.plusDays(1));

        List<DutyAssignment> inputOrder = scheduler(HolidayCalendar.none())
                .schedule(request(dates, List.of(x, a)), LegacyScoring.defaults());
        assertThat(inputOrder).extracting(DutyAssignment::memberId).containsExactly("x", "a");

        List<DutyAssignment> byId = scheduler(HolidayCalendar.none())
                .schedule(request(dates, List.of(x, a)), new LegacyScoring(-2, 1.0, TieBreakPolicy.MEMBER_ID));
        assertThat(byId).extracting(DutyAssignment::memberId).containsExactly("a", "x");
    }

    @Test
    void nonFiniteHistoricalPointsAreRejected() {
        MemberForAssignment broken = MemberForAssignment.builder().memberId("n").historicalPoints(Double.NaN).build();
        MemberForAssignment endless = MemberForAssignment.builder().memberId("i")
                .historicalPoints(Double.POSITIVE_INFINITY).build();

        assertThatThrownBy(() -> scheduler(HolidayCalendar.none())
                .schedule(request(List.of(MONDAY), List.of(broken)), LegacyScoring.defaults()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("historicalPoints");
        assertThatThrownBy(() -> scheduler(HolidayCalendar.none())
                .schedule(request(List.of(MONDAY), List.of(endless)), LegacyScoring.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void duplicateAndBlankMemberIdsAreIgnored() {
        MemberForAssignment first = MemberForAssignment.builder().memberId("a").historicalPoints(100).build();
        MemberForAssignment duplicate = MemberForAssignment.builder().memberId("a").historicalPoints(0).build();
        MemberForAssignment blank = MemberForAssignment.builder().memberId(" ").build();
        MemberForAssignment b = MemberForAssignment.builder().memberId("b").historicalPoints(50).build();

        List<DutyAssignment> result = scheduler(HolidayCalendar.none())
                .schedule(request(List.of(MONDAY), List.of(first, duplicate, blank, b)), LegacyScoring.defaults());

        assertThat(result).extracting(DutyAssignment::memberId).containsExactly("b");
    }

    @Test
    void holidayMultiplierRaisesAwardedPoints() {
        LocalDate christmasEve = LocalDate.of(2024, 12, 24);
        LocalDate ordinary = LocalDate.of(2024, 12, 27);
        MemberForAssignment a = MemberForAssignment.builder().memberId("a").build();

        List<DutyAssignment> result = scheduler(new SwedishHolidayCalendar())
                .schedule(request(List.of(christmasEve, ordinary), List.of(a)),
                        new LegacyScoring(-2, 2.0, TieBreakPolicy.INPUT_ORDER));

        assertThat(result.get(0).holiday()).isTrue();
        assertThat(result.get(0).pointsAwarded()).isEqualTo(20.0);
        assertThat(result.get(1).holiday()).isFalse();
        assertThat(result.get(1).pointsAwarded()).isEqualTo(10.0);
    }

    @Test
    void holidayWithDefaultMultiplierAwardsPlainPointsValue() {
        MemberForAssignment a = MemberForAssignment.builder().memberId("a").build();
        List<DutyAssignment> result = scheduler(new SwedishHolidayCalendar())
                .schedule(request(List.of(LocalDate.of(2024, 12, 25)), List.of(a)), LegacyScoring.defaults());
        assertThat(result.get(0).holiday()).isTrue();
        assertThat(result.get(0).pointsAwarded()).isEqualTo(10.0);
    }

    @Test
    void generatedRostersRespectAvailabilityAndCaps() {
        Random random = new Random(42);
        GreedyFairnessScheduler scheduler = scheduler(HolidayCalendar.none());

        for (int round = 0; round < 25; round++) {
            List<MemberForAssignment> roster = new ArrayList<>();
            int size = random.nextInt(5);
            for (int i = 0; i < size; i++) {
                List<WeeklyTimeRule> never = new ArrayList<>();
                if (random.nextBoolean()) {
                    never.add(WeeklyTimeRule.of(1 + random.nextInt(7), TimeSlot.of("06:00", "09:00")));
                }
                roster.add(MemberForAssignment.builder()
                        .memberId("m" + i)
                        .historicalPoints(random.nextInt(30))
                        .availability(MemberAvailability.builder().neverAvailable(never).build())
                        .limits(MemberLimits.builder()
                                .maxShiftsPerWeek(random.nextBoolean() ? 1 + random.nextInt(3) : null)
                                .maxShiftsPerMonth(random.nextBoolean() ? 2 + random.nextInt(6) : null)
                                .build())
                        .build());
            }
            List<LocalDate> dates = new ArrayList<>();
            LocalDate d = LocalDate.of(2024, 1, 1).plusDays(random.nextInt(60));
            int count = random.nextInt(40);
            for (int i = 0; i < count; i++) {
                dates.add(d);
                d = d.plusDays(1 + random.nextInt(2));
            }

            List<DutyAssignment> result = scheduler.schedule(request(dates, roster), LegacyScoring.defaults());
            Map<String, MemberForAssignment> byId = roster.stream()
                    .collect(Collectors.toMap(MemberForAssignment::getMemberId, m -> m));

            // 入力日付のみ、各日1回まで
            assertThat(result).extracting(DutyAssignment::date).doesNotHaveDuplicates();
            assertThat(dates).containsAll(result.stream().map(DutyAssignment::date).toList());

            Map<String, Integer> perWeek = new HashMap<>();
            Map<String, Integer> perMonth = new HashMap<>();
            Map<String, Double> awarded = new HashMap<>();
            Map<String, Integer> shifts = new HashMap<>();
            for (DutyAssignment r : result) {
                MemberForAssignment m = byId.get(r.memberId());
                assertThat(m).isNotNull();
                List<WeeklyTimeRule> never = m.getAvailability().getNeverAvailable();
                assertThat(calendar.matchesAny(never, r.date(), SEVEN)).isFalse();

                String weekKey = m.getMemberId() + "/" + r.date().get(IsoFields.WEEK_BASED_YEAR)
                        + "-" + r.date().get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
                String monthKey = m.getMemberId() + "/" + r.date().getYear() + "-" + r.date().getMonthValue();
                int w = perWeek.merge(weekKey, 1, Integer::sum);
                int mo = perMonth.merge(monthKey, 1, Integer::sum);
                if (m.getLimits().getMaxShiftsPerWeek() != null) {
                    assertThat(w).isLessThanOrEqualTo(m.getLimits().getMaxShiftsPerWeek());
                }
                if (m.getLimits().getMaxShiftsPerMonth() != null) {
                    assertThat(mo).isLessThanOrEqualTo(m.getLimits().getMaxShiftsPerMonth());
                }
                awarded.merge(r.memberId(), r.pointsAwarded(), Double::sum);
                shifts.merge(r.memberId(), 1, Integer::sum);
            }
            // 1回の割当ごとに pointsValue ちょうど増える
            shifts.forEach((id, n) -> assertThat(awarded.get(id)).isEqualTo(n * 10.0));
        }
    }
}
