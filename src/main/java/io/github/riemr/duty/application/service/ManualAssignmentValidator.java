package io.github.riemr.duty.application.service;

import io.github.riemr.duty.domain.model.MemberForAssignment;
import io.github.riemr.duty.optimization.filter.AvailabilityFilter;
import io.github.riemr.duty.optimization.filter.LimitFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;

/**
 * 手動割当の事前チェック。自動割当と同じ可否・上限ルールを使う。
 */
@Component
@RequiredArgsConstructor
public class ManualAssignmentValidator {

    private final AvailabilityFilter availabilityFilter;
    private final LimitFilter limitFilter;

    /** 手動割当時点での対象メンバーの週・月の割当数 */
    public record PeriodCounters(int shiftsThisWeek, int shiftsThisMonth) {
    }

    /**
     * @param counters null の場合は上限チェックを行わない
     * @return 割当不可の理由。問題なければ empty
     */
    public Optional<String> validate(MemberForAssignment member, LocalDate date, LocalTime startTime,
                                     PeriodCounters counters) {
        String name = member.getDisplayName() != null ? member.getDisplayName() : member.getMemberId();
        if (!availabilityFilter.isAvailable(member, date, startTime)) {
            return Optional.of(name + " is not available during this time slot");
        }
        if (counters != null && member.getLimits() != null) {
            if (limitFilter.hasReachedWeeklyLimit(member.getLimits(), counters.shiftsThisWeek())) {
                return Optional.of(name + " has reached their maximum shifts per week ("
                        + member.getLimits().getMaxShiftsPerWeek() + ")");
            }
            if (limitFilter.hasReachedMonthlyLimit(member.getLimits(), counters.shiftsThisMonth())) {
                return Optional.of(name + " has reached their maximum shifts per month ("
                        + member.getLimits().getMaxShiftsPerMonth() + ")");
            }
        }
        return Optional.empty();
    }
}
