package io.github.riemr.duty.optimization.config;

/**
 * 同点時の決定方法。
 */
public enum TieBreakPolicy {
    /** 名簿の並び順で最初に最小スコアとなったメンバー */
    INPUT_ORDER,
    /** メンバーIDの昇順に並べ替えてから評価 */
    MEMBER_ID;

    public static TieBreakPolicy fromCode(String code) {
        if (code == null || code.isBlank()) {
            return INPUT_ORDER;
        }
        try {
            return TieBreakPolicy.valueOf(code.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown tie-break policy: " + code, ex);
        }
    }
}
