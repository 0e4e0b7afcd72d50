package io.github.riemr.duty.optimization.filter;

import io.github.riemr.duty.domain.model.MemberForAssignment;
import io.github.riemr.duty.domain.model.MemberLimits;
import io.github.riemr.duty.optimization.entity.MemberTrackingState;
import org.springframework.stereotype.Component;

/**
 * 週・月の上限に達したメンバーを除外する。上限未設定は無制限。
 */
@Component
public class LimitFilter {

    public boolean hasReachedLimits(MemberForAssignment member, MemberTrackingState tracking) {
        return hasReachedWeeklyLimit(member.getLimits(), tracking.getShiftsThisWeek())
                || hasReachedMonthlyLimit(member.getLimits(), tracking.getShiftsThisMonth());
    }

    public boolean hasReachedWeeklyLimit(MemberLimits limits, int shiftsThisWeek) {
        return limits != null && limits.getMaxShiftsPerWeek() != null
                && shiftsThisWeek >= limits.getMaxShiftsPerWeek();
    }

    public boolean hasReachedMonthlyLimit(MemberLimits limits, int shiftsThisMonth) {
        return limits != null && limits.getMaxShiftsPerMonth() != null
                && shiftsThisMonth >= limits.getMaxShiftsPerMonth();
    }
}
