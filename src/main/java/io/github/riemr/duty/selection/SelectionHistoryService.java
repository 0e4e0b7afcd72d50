package io.github.riemr.duty.selection;

import io.github.riemr.duty.application.repository.SelectionHistoryRepository;
import io.github.riemr.duty.domain.model.SelectionHistory;
import io.github.riemr.duty.domain.model.SelectionHistoryTurn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 完了した選択プロセスの最終順を保存する。次回の QUOTA_BASED / FAIR_ROTATION が参照する。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SelectionHistoryService {

    private final SelectionHistoryRepository selectionHistoryRepository;
    private final Clock clock;

    /** 選択プロセス中に1メンバーが取った当番 */
    public record PickedDuty(String memberId, double pointsValue) {
    }

    /**
     * @param turns  最終的な順番（先頭が1番）
     * @param picks  プロセス中の選択結果
     * @return 保存した履歴
     */
    public SelectionHistory recordCompletedProcess(String organizationId, String stableId, String processId,
                                                   String processName, String algorithm,
                                                   List<Turn> turns, List<PickedDuty> picks) {
        Map<String, Double> pointsByMember = new HashMap<>();
        Map<String, Integer> countByMember = new HashMap<>();
        for (PickedDuty p : picks == null ? List.<PickedDuty>of() : picks) {
            pointsByMember.merge(p.memberId(), p.pointsValue(), Double::sum);
            countByMember.merge(p.memberId(), 1, Integer::sum);
        }

        List<SelectionHistoryTurn> finalOrder = new ArrayList<>();
        int order = 1;
        for (Turn t : turns) {
            if (!t.hasMemberId()) continue;
            finalOrder.add(new SelectionHistoryTurn(t.memberId(), t.memberName(), order++,
                    countByMember.getOrDefault(t.memberId(), 0),
                    pointsByMember.getOrDefault(t.memberId(), 0.0)));
        }

        SelectionHistory history = SelectionHistory.builder()
                .organizationId(organizationId)
                .stableId(stableId)
                .processId(processId)
                .processName(processName)
                .algorithm(algorithm == null ? SelectionAlgorithm.MANUAL.code() : algorithm)
                .finalTurnOrder(finalOrder)
                .completedAt(clock.instant())
                .build();
        SelectionHistory saved = selectionHistoryRepository.save(history);
        log.info("Recorded selection history {} for stable {} ({} turns)", saved.getId(), stableId, finalOrder.size());
        return saved;
    }
}
