package io.github.riemr.duty.domain.model;

import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 期間ごとの割当上限。null は無制限。
 */
@Data
@NoArgsConstructor
public class MemberLimits {
    private Integer maxShiftsPerWeek;
    private Integer maxShiftsPerMonth;

    @Builder
    public MemberLimits(Integer maxShiftsPerWeek, Integer maxShiftsPerMonth) {
        setMaxShiftsPerWeek(maxShiftsPerWeek);
        setMaxShiftsPerMonth(maxShiftsPerMonth);
    }

    public void setMaxShiftsPerWeek(Integer maxShiftsPerWeek) {
        this.maxShiftsPerWeek = requireNonNegative(maxShiftsPerWeek, "maxShiftsPerWeek");
    }

    public void setMaxShiftsPerMonth(Integer maxShiftsPerMonth) {
        this.maxShiftsPerMonth = requireNonNegative(maxShiftsPerMonth, "maxShiftsPerMonth");
    }

    private static Integer requireNonNegative(Integer value, String name) {
        if (value != null && value < 0) throw new IllegalArgumentException(name + " must be >= 0");
        return value;
    }
}
