package io.github.riemr.duty.domain.model;

/**
 * 完了した選択プロセスでの1メンバー分の記録。
 */
public record SelectionHistoryTurn(String memberId, String memberName, int order,
                                   int selectionsCount, double totalPointsPicked) {
}
