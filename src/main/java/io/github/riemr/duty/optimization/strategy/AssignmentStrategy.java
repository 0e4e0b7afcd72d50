package io.github.riemr.duty.optimization.strategy;

import io.github.riemr.duty.application.dto.AssignmentRequest;
import io.github.riemr.duty.domain.model.DutyAssignment;

import java.util.List;

/**
 * 日付列を割当結果に変換する戦略。割当できなかった日は結果に含めない。
 */
@FunctionalInterface
public interface AssignmentStrategy {

    List<DutyAssignment> assign(AssignmentRequest request);
}
