package io.github.riemr.duty.optimization.strategy;

import io.github.riemr.duty.application.dto.AssignmentRequest;
import io.github.riemr.duty.application.util.DutyCalendar;
import io.github.riemr.duty.application.util.HolidayCalendar;
import io.github.riemr.duty.domain.model.DutyAssignment;
import io.github.riemr.duty.domain.model.MemberForAssignment;
import io.github.riemr.duty.optimization.config.LegacyScoring;
import io.github.riemr.duty.optimization.config.TieBreakPolicy;
import io.github.riemr.duty.optimization.entity.MemberTrackingState;
import io.github.riemr.duty.optimization.filter.AvailabilityFilter;
import io.github.riemr.duty.optimization.filter.LimitFilter;
import io.github.riemr.duty.optimization.score.FairnessScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 日付ごとの貪欲割当。
 * <ol>
 *   <li>週・月の境界をまたいだら全メンバーの週/月カウンタをリセット</li>
 *   <li>不可枠・上限で候補を絞り込む</li>
 *   <li>候補がなければその日は飛ばす（結果に含めない）</li>
 *   <li>公平性スコア最小のメンバーを割り当て、集計を更新</li>
 * </ol>
 * 先読み・バックトラックはしない。集計状態は呼び出しごとに生成するため、並行実行しても干渉しない。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GreedyFairnessScheduler {

    private final DutyCalendar calendar;
    private final AvailabilityFilter availabilityFilter;
    private final LimitFilter limitFilter;
    private final FairnessScorer scorer;
    private final HolidayCalendar holidayCalendar;

    public List<DutyAssignment> schedule(AssignmentRequest request, LegacyScoring scoring) {
        List<LocalDate> dates = Optional.ofNullable(request.getDates()).orElse(List.of());
        List<MemberForAssignment> roster = orderRoster(request.getMembers(), scoring.tieBreak());
        if (dates.isEmpty() || roster.isEmpty()) {
            log.debug("Nothing to schedule: dates={}, members={}", dates.size(), roster.size());
            return List.of();
        }
        LocalTime startTime = request.getScheduledStartTime();

        Map<String, MemberTrackingState> tracking = new LinkedHashMap<>();
        for (MemberForAssignment m : roster) {
            tracking.put(m.getMemberId(), new MemberTrackingState());
        }

        List<DutyAssignment> results = new ArrayList<>();
        LocalDate previous = null;
        for (LocalDate date : dates) {
            if (previous != null) {
                if (!calendar.isSameWeek(previous, date)) {
                    tracking.values().forEach(MemberTrackingState::resetWeek);
                }
                if (!calendar.isSameMonth(previous, date)) {
                    tracking.values().forEach(MemberTrackingState::resetMonth);
                }
            }
            previous = date;

            MemberForAssignment best = null;
            double bestScore = Double.POSITIVE_INFINITY;
            int eligible = 0;
            for (MemberForAssignment member : roster) {
                MemberTrackingState state = tracking.get(member.getMemberId());
                if (!availabilityFilter.isAvailable(member, date, startTime)) continue;
                if (limitFilter.hasReachedLimits(member, state)) continue;
                eligible++;
                double score = scorer.score(member, state, date, startTime, scoring.preferenceBonus());
                // 厳密に小さい場合のみ更新 -> 同点は先に評価したメンバー
                if (score < bestScore) {
                    bestScore = score;
                    best = member;
                }
            }

            if (best == null) {
                log.warn("No eligible member for {} {}, leaving it unassigned", DutyCalendar.format(date), startTime);
                continue;
            }

            boolean holiday = holidayCalendar.isHoliday(date);
            double awarded = holiday ? request.getPointsValue() * scoring.holidayMultiplier() : request.getPointsValue();
            tracking.get(best.getMemberId()).recordAssignment(date, awarded);
            results.add(new DutyAssignment(date, best.getMemberId(), awarded, holiday));
            log.debug("{}: {} eligible, assigned {} (score={}, points={}{})", DutyCalendar.format(date), eligible,
                    best.getMemberId(), bestScore, awarded, holiday ? ", holiday" : "");
        }
        return results;
    }

    private List<MemberForAssignment> orderRoster(List<MemberForAssignment> members, TieBreakPolicy tieBreak) {
        if (members == null || members.isEmpty()) return List.of();
        // 同一IDは最初の1件のみ採用
        Map<String, MemberForAssignment> unique = new LinkedHashMap<>();
        for (MemberForAssignment m : members) {
            if (m == null || m.getMemberId() == null || m.getMemberId().isBlank()) {
                log.warn("Ignoring roster entry without member id: {}", m);
                continue;
            }
            // NaN / 無限大は最小スコア比較で決して選ばれないため入力エラーにする
            if (!Double.isFinite(m.getHistoricalPoints())) {
                throw new IllegalArgumentException("historicalPoints must be finite for member "
                        + m.getMemberId() + ": " + m.getHistoricalPoints());
            }
            if (unique.putIfAbsent(m.getMemberId(), m) != null) {
                log.warn("Duplicate member id {} in roster, keeping the first entry", m.getMemberId());
            }
        }
        List<MemberForAssignment> ordered = new ArrayList<>(unique.values());
        if (tieBreak == TieBreakPolicy.MEMBER_ID) {
            ordered.sort(Comparator.comparing(MemberForAssignment::getMemberId));
        }
        return ordered;
    }
}
