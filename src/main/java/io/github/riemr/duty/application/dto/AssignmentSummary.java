package io.github.riemr.duty.application.dto;

import io.github.riemr.duty.domain.model.DutyAssignment;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 割当結果の集計。memberDistribution は初回割当順。
 */
public record AssignmentSummary(int totalAssigned, double totalPoints, int holidayShifts,
                                Map<String, MemberDistribution> memberDistribution,
                                List<LocalDate> unassignedDates) {

    public record MemberDistribution(int shifts, double points) {
        MemberDistribution plus(double awarded) {
            return new MemberDistribution(shifts + 1, points + awarded);
        }
    }

    public static AssignmentSummary from(AssignmentResult result) {
        Map<String, MemberDistribution> distribution = new LinkedHashMap<>();
        double totalPoints = 0;
        int holidayShifts = 0;
        for (DutyAssignment a : result.assignments()) {
            totalPoints += a.pointsAwarded();
            if (a.holiday()) holidayShifts++;
            distribution.merge(a.memberId(), new MemberDistribution(1, a.pointsAwarded()),
                    (current, ignored) -> current.plus(a.pointsAwarded()));
        }
        return new AssignmentSummary(result.assignments().size(), totalPoints, holidayShifts,
                Collections.unmodifiableMap(distribution), result.unassignedDates());
    }
}
