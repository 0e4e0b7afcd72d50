package io.github.riemr.duty.selection;

public enum SelectionAlgorithm {
    MANUAL,
    QUOTA_BASED,
    POINTS_BALANCE,
    FAIR_ROTATION;

    /** "points_balance" 形式も受け付ける。不明な値は MANUAL 扱い */
    public static SelectionAlgorithm fromCode(String code) {
        if (code == null || code.isBlank()) {
            return MANUAL;
        }
        try {
            return SelectionAlgorithm.valueOf(code.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException ex) {
            return MANUAL;
        }
    }

    public String code() {
        return name().toLowerCase();
    }
}
