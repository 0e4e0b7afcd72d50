package io.github.riemr.duty.selection;

import io.github.riemr.duty.application.repository.DutyLedgerRepository;
import io.github.riemr.duty.application.repository.SelectionHistoryRepository;
import io.github.riemr.duty.application.repository.StableMemberRepository;
import io.github.riemr.duty.application.util.DutyCalendar;
import io.github.riemr.duty.config.DutyAssignmentSettings;
import io.github.riemr.duty.domain.model.CompletedDuty;
import io.github.riemr.duty.domain.model.OpenDuty;
import io.github.riemr.duty.domain.model.SelectionHistory;
import io.github.riemr.duty.domain.model.SelectionHistoryTurn;
import io.github.riemr.duty.domain.model.StableMember;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.Collator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 選択プロセスの順番計算。
 * <ul>
 *   <li>QUOTA_BASED: 前回順の逆順。期間内の未割当ポイントから1人あたりの目安を算出</li>
 *   <li>POINTS_BALANCE: 直近 memoryHorizonDays 日の獲得ポイントが少ない順</li>
 *   <li>FAIR_ROTATION: 前回順を1つずらす（先頭が末尾へ）</li>
 *   <li>MANUAL: 指定順のまま</li>
 * </ul>
 * 前回にいないメンバーは表示名のアルファベット順で末尾に追加する。
 * 対象は厩舎の有効メンバーとオーナー。それ以外のIDは順番から外す。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SelectionAlgorithmService implements TurnOrderProvider {

    private final StableMemberRepository stableMemberRepository;
    private final SelectionHistoryRepository selectionHistoryRepository;
    private final DutyLedgerRepository dutyLedgerRepository;
    private final DutyAssignmentSettings settings;
    private final Clock clock;

    @Override
    public TurnOrder computeTurnOrder(TurnOrderRequest request) {
        List<Turn> members = resolveMemberDetails(request.stableId(), request.memberIds());
        SelectionAlgorithm algorithm = SelectionAlgorithm.fromCode(request.algorithm());
        log.debug("Computing {} turn order for stable {} ({} of {} members resolved)",
                algorithm.code(), request.stableId(), members.size(), request.memberIds().size());

        switch (algorithm) {
            case QUOTA_BASED:
                return computeQuotaBasedOrder(request, members);
            case POINTS_BALANCE:
                return computePointsBalanceOrder(request.stableId(), members);
            case FAIR_ROTATION:
                return computeFairRotationOrder(request.stableId(), members);
            case MANUAL:
            default:
                return new TurnOrder(members, SelectionAlgorithm.MANUAL.code(), Map.of());
        }
    }

    /* ===================================================================== */
    /* Algorithms                                                            */
    /* ===================================================================== */

    private TurnOrder computeQuotaBasedOrder(TurnOrderRequest request, List<Turn> members) {
        double totalAvailablePoints = 0;
        LocalDate from = parseWindowDate(request.selectionStartDate());
        LocalDate to = parseWindowDate(request.selectionEndDate());
        if (from != null && to != null) {
            for (OpenDuty duty : dutyLedgerRepository.findUnassignedBetween(request.stableId(), from, to)) {
                totalAvailablePoints += duty.getPointsValue();
            }
        }
        double quotaPerMember = members.isEmpty() ? 0 : Math.round(totalAvailablePoints / members.size() * 10) / 10.0;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("quotaPerMember", quotaPerMember);
        metadata.put("totalAvailablePoints", totalAvailablePoints);

        Optional<SelectionHistory> history = selectionHistoryRepository.findLastCompleted(request.stableId());
        List<Turn> ordered;
        if (history.isPresent()) {
            List<String> reversed = new ArrayList<>(lastOrderIds(history.get()));
            Collections.reverse(reversed);
            ordered = reorderFromHistory(members, reversed);
            putPrevious(metadata, history.get());
        } else {
            ordered = sortByName(members);
        }
        return new TurnOrder(ordered, SelectionAlgorithm.QUOTA_BASED.code(), metadata);
    }

    private TurnOrder computePointsBalanceOrder(String stableId, List<Turn> members) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(settings.getMemoryHorizonDays()));

        Map<String, Double> pointsMap = new LinkedHashMap<>();
        for (Turn m : members) {
            pointsMap.put(m.memberId(), 0.0);
        }
        for (CompletedDuty duty : dutyLedgerRepository.findCompletedSince(stableId, cutoff)) {
            String by = duty.getCompletedBy();
            if (by != null && pointsMap.containsKey(by)) {
                pointsMap.merge(by, duty.effectivePoints(), Double::sum);
            }
        }

        Comparator<Turn> byPoints = Comparator.comparingDouble(t -> pointsMap.getOrDefault(t.memberId(), 0.0));
        List<Turn> ordered = members.stream()
                .sorted(byPoints.thenComparing(nameComparator()))
                .toList();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("memberPointsMap", pointsMap);
        return new TurnOrder(ordered, SelectionAlgorithm.POINTS_BALANCE.code(), metadata);
    }

    private TurnOrder computeFairRotationOrder(String stableId, List<Turn> members) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        Optional<SelectionHistory> history = selectionHistoryRepository.findLastCompleted(stableId);
        List<Turn> ordered;
        if (history.isPresent() && !history.get().getFinalTurnOrder().isEmpty()) {
            List<String> last = lastOrderIds(history.get());
            List<String> shifted = new ArrayList<>(last.subList(1, last.size()));
            shifted.add(last.get(0));
            ordered = reorderFromHistory(members, shifted);
            putPrevious(metadata, history.get());
        } else {
            ordered = sortByName(members);
        }
        return new TurnOrder(ordered, SelectionAlgorithm.FAIR_ROTATION.code(), metadata);
    }

    /* ===================================================================== */
    /* Helpers                                                               */
    /* ===================================================================== */

    private List<Turn> resolveMemberDetails(String stableId, List<String> memberIds) {
        Map<String, StableMember> known = new HashMap<>();
        for (StableMember sm : stableMemberRepository.findActiveByStable(stableId)) {
            known.put(sm.getMemberId(), sm);
        }
        // オーナーはメンバー行が無い・無効でも対象に含める
        stableMemberRepository.findOwner(stableId)
                .ifPresent(owner -> known.putIfAbsent(owner.getMemberId(), owner));
        List<Turn> members = new ArrayList<>();
        for (String id : memberIds) {
            StableMember sm = known.get(id);
            if (sm == null) {
                log.debug("Member {} is not an active member of stable {}, dropped from turn order", id, stableId);
                continue;
            }
            members.add(new Turn(id, sm.resolveDisplayName(), sm.getEmail() == null ? "" : sm.getEmail()));
        }
        return members;
    }

    private List<String> lastOrderIds(SelectionHistory history) {
        return history.getFinalTurnOrder().stream()
                .sorted(Comparator.comparingInt(SelectionHistoryTurn::order))
                .map(SelectionHistoryTurn::memberId)
                .toList();
    }

    // 履歴順に現メンバーを並べ、履歴にいないメンバーを名前順で末尾へ
    private List<Turn> reorderFromHistory(List<Turn> members, List<String> historyOrder) {
        Map<String, Turn> remaining = new LinkedHashMap<>();
        for (Turn m : members) {
            remaining.put(m.memberId(), m);
        }
        List<Turn> ordered = new ArrayList<>();
        for (String id : historyOrder) {
            Turn m = remaining.remove(id);
            if (m != null) ordered.add(m);
        }
        ordered.addAll(sortByName(new ArrayList<>(remaining.values())));
        return ordered;
    }

    private List<Turn> sortByName(List<Turn> members) {
        return members.stream().sorted(nameComparator()).toList();
    }

    private Comparator<Turn> nameComparator() {
        Collator collator = Collator.getInstance(settings.getCollationLocale());
        return (a, b) -> collator.compare(a.memberName(), b.memberName());
    }

    private void putPrevious(Map<String, Object> metadata, SelectionHistory history) {
        if (history.getProcessId() != null) metadata.put("previousProcessId", history.getProcessId());
        if (history.getProcessName() != null) metadata.put("previousProcessName", history.getProcessName());
    }

    private LocalDate parseWindowDate(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return DutyCalendar.parseDate(raw);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid selection window date: " + raw, e);
        }
    }
}
