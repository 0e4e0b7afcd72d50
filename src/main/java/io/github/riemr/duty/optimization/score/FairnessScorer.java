package io.github.riemr.duty.optimization.score;

import io.github.riemr.duty.application.util.DutyCalendar;
import io.github.riemr.duty.domain.model.MemberAvailability;
import io.github.riemr.duty.domain.model.MemberForAssignment;
import io.github.riemr.duty.optimization.entity.MemberTrackingState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 公平性スコア。小さいほど優先して割り当てる。
 * <pre>
 * score = historicalPoints + sessionPoints + (希望時間帯なら preferenceBonus, それ以外 0)
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class FairnessScorer {

    private final DutyCalendar calendar;

    public double score(MemberForAssignment member, MemberTrackingState tracking,
                        LocalDate date, LocalTime startTime, double preferenceBonus) {
        return member.getHistoricalPoints()
                + tracking.getSessionPoints()
                + preferenceBonus(member, date, startTime, preferenceBonus);
    }

    public double preferenceBonus(MemberForAssignment member, LocalDate date, LocalTime startTime, double bonus) {
        MemberAvailability availability = member.getAvailability();
        if (availability == null || !availability.hasPreferences()) return 0;
        return calendar.matchesAny(availability.getPreferredTimes(), date, startTime) ? bonus : 0;
    }
}
