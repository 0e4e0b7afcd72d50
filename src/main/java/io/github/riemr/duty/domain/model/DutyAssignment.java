package io.github.riemr.duty.domain.model;

import java.time.LocalDate;

/**
 * 1日分の割当結果。
 *
 * @param pointsAwarded 付与したポイント（祝日倍率適用後）
 * @param holiday       祝日扱いだったか
 */
public record DutyAssignment(LocalDate date, String memberId, double pointsAwarded, boolean holiday) {
}
