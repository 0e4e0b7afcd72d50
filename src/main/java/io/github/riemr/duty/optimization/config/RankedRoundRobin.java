package io.github.riemr.duty.optimization.config;

import java.time.LocalDate;
import java.util.Objects;

/**
 * 外部の順番計算に従って日付を巡回割当する方式のパラメータ。
 *
 * @param windowStart 順番計算に渡す選択期間の開始日（含む）
 * @param windowEnd   選択期間の終了日（含む）
 */
public record RankedRoundRobin(String algorithm, String stableId, String organizationId,
                               LocalDate windowStart, LocalDate windowEnd) implements AssignmentMode {

    public RankedRoundRobin {
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(stableId, "stableId");
        Objects.requireNonNull(organizationId, "organizationId");
    }

    @Override
    public String label() {
        return "RANKED_ROUND_ROBIN";
    }
}
