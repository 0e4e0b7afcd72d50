package io.github.riemr.duty.optimization.filter;

import io.github.riemr.duty.application.util.DutyCalendar;
import io.github.riemr.duty.domain.model.MemberAvailability;
import io.github.riemr.duty.domain.model.MemberForAssignment;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 不可枠（neverAvailable）に開始時刻が掛かるメンバーを除外する。
 */
@Component
@RequiredArgsConstructor
public class AvailabilityFilter {

    private final DutyCalendar calendar;

    public boolean isAvailable(MemberForAssignment member, LocalDate date, LocalTime startTime) {
        MemberAvailability availability = member.getAvailability();
        if (availability == null || !availability.hasRestrictions()) {
            return true;
        }
        return !calendar.matchesAny(availability.getNeverAvailable(), date, startTime);
    }
}
