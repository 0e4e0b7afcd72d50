package io.github.riemr.duty.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 完了済みの当番。ポイント残高順の計算に使う。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletedDuty {
    private String stableId;
    private String completedBy;
    private Instant completedAt;
    private Double pointsAwarded; // 未設定なら pointsValue を使う
    private double pointsValue;

    public double effectivePoints() {
        return pointsAwarded != null ? pointsAwarded : pointsValue;
    }
}
