package io.github.riemr.duty.selection;

import java.util.List;
import java.util.Map;

/**
 * 順番計算の結果。
 *
 * @param metadata アルゴリズム固有の補足情報（quotaPerMember など）
 */
public record TurnOrder(List<Turn> turns, String algorithm, Map<String, Object> metadata) {

    public TurnOrder {
        turns = turns == null ? List.of() : List.copyOf(turns);
        metadata = metadata == null ? Map.of() : metadata;
    }

    /** ID を持つ枠のメンバーIDを順番どおりに返す */
    public List<String> memberIds() {
        return turns.stream().filter(Turn::hasMemberId).map(Turn::memberId).toList();
    }
}
