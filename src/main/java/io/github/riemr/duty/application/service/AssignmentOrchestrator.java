package io.github.riemr.duty.application.service;

import io.github.riemr.duty.application.dto.AssignmentOptions;
import io.github.riemr.duty.application.dto.AssignmentRequest;
import io.github.riemr.duty.application.dto.AssignmentResult;
import io.github.riemr.duty.application.exception.AssignmentConfigurationException;
import io.github.riemr.duty.application.util.DutyCalendar;
import io.github.riemr.duty.config.DutyAssignmentSettings;
import io.github.riemr.duty.domain.model.DutyAssignment;
import io.github.riemr.duty.domain.model.MemberForAssignment;
import io.github.riemr.duty.optimization.config.AssignmentMode;
import io.github.riemr.duty.optimization.config.LegacyScoring;
import io.github.riemr.duty.optimization.config.RankedRoundRobin;
import io.github.riemr.duty.optimization.config.TieBreakPolicy;
import io.github.riemr.duty.optimization.strategy.AssignmentStrategy;
import io.github.riemr.duty.optimization.strategy.GreedyFairnessScheduler;
import io.github.riemr.duty.optimization.strategy.RoundRobinDistributor;
import io.github.riemr.duty.selection.TurnOrder;
import io.github.riemr.duty.selection.TurnOrderProvider;
import io.github.riemr.duty.selection.TurnOrderProviderException;
import io.github.riemr.duty.selection.TurnOrderRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 当番割当の入口。設定から方式を一度だけ決め、対応する戦略に委譲する。
 * <ul>
 *   <li>algorithm / stableId / organizationId が揃っている: 順番計算 → 巡回割当</li>
 *   <li>それ以外: 公平性スコアによる貪欲割当</li>
 * </ul>
 * 順番計算の失敗は呼び出し元へそのまま伝播する（貪欲割当へのフォールバックはしない）。
 */
@Service
@Slf4j
public class AssignmentOrchestrator {

    private final GreedyFairnessScheduler greedyFairnessScheduler;
    private final RoundRobinDistributor roundRobinDistributor;
    private final TurnOrderProvider turnOrderProvider;
    private final ExecutorService turnOrderExecutor;
    private final DutyAssignmentSettings settings;

    public AssignmentOrchestrator(GreedyFairnessScheduler greedyFairnessScheduler,
                                  RoundRobinDistributor roundRobinDistributor,
                                  TurnOrderProvider turnOrderProvider,
                                  @Qualifier("turnOrderExecutor") ExecutorService turnOrderExecutor,
                                  DutyAssignmentSettings settings) {
        this.greedyFairnessScheduler = greedyFairnessScheduler;
        this.roundRobinDistributor = roundRobinDistributor;
        this.turnOrderProvider = turnOrderProvider;
        this.turnOrderExecutor = turnOrderExecutor;
        this.settings = settings;
    }

    /* ===================================================================== */
    /* Public API                                                            */
    /* ===================================================================== */

    /**
     * 日付（yyyy-MM-dd）→ メンバーID の割当表を返す。候補がいない日はキー自体が存在しない。
     *
     * @param scheduledStartTime "HH:MM"（"HH:MM-HH:MM" も可）
     */
    public Map<String, String> assign(List<LocalDate> dates, List<MemberForAssignment> members,
                                      String scheduledStartTime, double pointsValue, AssignmentOptions options) {
        LocalTime start;
        try {
            start = DutyCalendar.parseStartTime(scheduledStartTime);
        } catch (IllegalArgumentException e) {
            throw new AssignmentConfigurationException(e.getMessage(), e);
        }
        AssignmentRequest request = AssignmentRequest.builder()
                .dates(dates == null ? new ArrayList<>() : new ArrayList<>(dates))
                .members(members == null ? new ArrayList<>() : new ArrayList<>(members))
                .scheduledStartTime(start)
                .pointsValue(pointsValue)
                .build();
        return assignDetailed(request, options).toDateMap();
    }

    /**
     * 割当を実行し、付与ポイントや未割当日を含む結果を返す。
     *
     * @throws AssignmentConfigurationException 開始時刻が未指定の場合
     * @throws TurnOrderProviderException 順番計算が失敗・タイムアウトした場合
     */
    public AssignmentResult assignDetailed(AssignmentRequest request, AssignmentOptions options) {
        Objects.requireNonNull(request, "request");
        // 開始時刻なしでは不可枠の判定ができない
        if (request.getScheduledStartTime() == null) {
            throw new AssignmentConfigurationException("scheduledStartTime is required");
        }
        AssignmentOptions opts = options == null ? AssignmentOptions.empty() : options;
        List<LocalDate> dates = normalizeDates(request.getDates());
        AssignmentRequest normalized = request.toBuilder().dates(dates).build();

        AssignmentMode mode = resolveMode(opts, dates);
        if (dates.isEmpty()) {
            log.info("No dates requested ({}), nothing to assign", mode.label());
            return new AssignmentResult(mode.label(), List.of(), List.of());
        }

        long t0 = System.currentTimeMillis();
        List<DutyAssignment> assignments = resolveStrategy(mode).assign(normalized);

        Set<LocalDate> assigned = new HashSet<>();
        assignments.forEach(a -> assigned.add(a.date()));
        List<LocalDate> unassigned = dates.stream().filter(d -> !assigned.contains(d)).toList();

        log.info("{}: assigned {}/{} dates ({} members, {} unassigned) in {} ms",
                mode.label(), assignments.size(), dates.size(),
                normalized.getMembers() == null ? 0 : normalized.getMembers().size(),
                unassigned.size(), System.currentTimeMillis() - t0);
        return new AssignmentResult(mode.label(), assignments, unassigned);
    }

    /**
     * 設定から方式を決める。選択期間は明示指定がなければ先頭・末尾の日付から補う。
     */
    public AssignmentMode resolveMode(AssignmentOptions options, List<LocalDate> dates) {
        if (options.hasRankingContext()) {
            LocalDate first = dates.isEmpty() ? null : dates.get(0);
            LocalDate last = dates.isEmpty() ? null : dates.get(dates.size() - 1);
            return new RankedRoundRobin(options.getAlgorithm().trim(), options.getStableId().trim(),
                    options.getOrganizationId().trim(),
                    options.getStartDate() != null ? options.getStartDate() : first,
                    options.getEndDate() != null ? options.getEndDate() : last);
        }
        try {
            double bonus = options.getPreferenceBonus() != null ? options.getPreferenceBonus() : settings.getPreferenceBonus();
            double multiplier = options.getHolidayMultiplier() != null ? options.getHolidayMultiplier() : settings.getHolidayMultiplier();
            TieBreakPolicy tieBreak = options.getTieBreak() != null ? TieBreakPolicy.fromCode(options.getTieBreak()) : settings.getTieBreak();
            return new LegacyScoring(bonus, multiplier, tieBreak);
        } catch (IllegalArgumentException e) {
            throw new AssignmentConfigurationException(e.getMessage(), e);
        }
    }

    /* ===================================================================== */
    /* Internal                                                              */
    /* ===================================================================== */

    AssignmentStrategy resolveStrategy(AssignmentMode mode) {
        if (mode instanceof RankedRoundRobin ranked) {
            return request -> distributeByTurnOrder(request, ranked);
        }
        if (mode instanceof LegacyScoring legacy) {
            return request -> greedyFairnessScheduler.schedule(request, legacy);
        }
        throw new IllegalStateException("Unsupported assignment mode: " + mode);
    }

    private List<DutyAssignment> distributeByTurnOrder(AssignmentRequest request, RankedRoundRobin ranked) {
        List<String> memberIds = new ArrayList<>();
        for (MemberForAssignment m : request.getMembers() == null ? List.<MemberForAssignment>of() : request.getMembers()) {
            if (m != null && m.getMemberId() != null) memberIds.add(m.getMemberId());
        }
        TurnOrderRequest turnOrderRequest = new TurnOrderRequest(
                ranked.stableId(), ranked.organizationId(), ranked.algorithm(), memberIds,
                ranked.windowStart() == null ? null : DutyCalendar.format(ranked.windowStart()),
                ranked.windowEnd() == null ? null : DutyCalendar.format(ranked.windowEnd()));

        TurnOrder turnOrder = fetchTurnOrder(turnOrderRequest);
        List<String> order = turnOrder.memberIds();
        if (order.isEmpty()) {
            log.warn("Turn order ({}) for stable {} has no usable member ids, nothing assigned",
                    turnOrder.algorithm(), ranked.stableId());
        }
        return roundRobinDistributor.distribute(order, request.getDates(), request.getPointsValue());
    }

    private TurnOrder fetchTurnOrder(TurnOrderRequest request) {
        Future<TurnOrder> future = turnOrderExecutor.submit(() -> turnOrderProvider.computeTurnOrder(request));
        long timeoutMillis = settings.getTurnOrderTimeout().toMillis();
        try {
            TurnOrder order = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            if (order == null) {
                throw new TurnOrderProviderException("Turn order provider returned no result for stable " + request.stableId());
            }
            return order;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Turn order computation timed out after {} ms (stable={}, algorithm={})",
                    timeoutMillis, request.stableId(), request.algorithm());
            throw new TurnOrderProviderException("Turn order computation timed out after " + timeoutMillis + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TurnOrderProviderException("Interrupted while waiting for turn order", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Turn order computation failed (stable={}, algorithm={})", request.stableId(), request.algorithm(), cause);
            if (cause instanceof TurnOrderProviderException tope) {
                throw tope;
            }
            throw new TurnOrderProviderException("Turn order computation failed: " + cause.getMessage(), cause);
        }
    }

    // 時系列順・重複なしに揃える
    private List<LocalDate> normalizeDates(List<LocalDate> dates) {
        if (dates == null || dates.isEmpty()) return List.of();
        TreeSet<LocalDate> sorted = new TreeSet<>();
        for (LocalDate d : dates) {
            if (d != null) sorted.add(d);
        }
        List<LocalDate> normalized = new ArrayList<>(sorted);
        if (!normalized.equals(dates)) {
            log.debug("Requested dates were reordered/deduplicated: {} -> {}", dates.size(), normalized.size());
        }
        return normalized;
    }
}
