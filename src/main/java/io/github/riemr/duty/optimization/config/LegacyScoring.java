package io.github.riemr.duty.optimization.config;

/**
 * 貪欲スコアリング方式のパラメータ。
 *
 * @param preferenceBonus   希望時間帯に加算する値（負数でボーナス）
 * @param holidayMultiplier 祝日の付与ポイント倍率（1.0 で通常日と同じ）
 * @param tieBreak          同点時の決定方法
 */
public record LegacyScoring(double preferenceBonus, double holidayMultiplier, TieBreakPolicy tieBreak)
        implements AssignmentMode {

    public static final double DEFAULT_PREFERENCE_BONUS = -2;

    public LegacyScoring {
        if (Double.isNaN(preferenceBonus) || Double.isInfinite(preferenceBonus)) {
            throw new IllegalArgumentException("preferenceBonus must be finite");
        }
        if (holidayMultiplier < 1.0 || Double.isInfinite(holidayMultiplier)) {
            throw new IllegalArgumentException("holidayMultiplier must be >= 1.0");
        }
        if (tieBreak == null) tieBreak = TieBreakPolicy.INPUT_ORDER;
    }

    public static LegacyScoring defaults() {
        return new LegacyScoring(DEFAULT_PREFERENCE_BONUS, 1.0, TieBreakPolicy.INPUT_ORDER);
    }

    @Override
    public String label() {
        return "LEGACY_SCORING";
    }
}
