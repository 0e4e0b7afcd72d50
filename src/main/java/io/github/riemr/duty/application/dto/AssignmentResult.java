package io.github.riemr.duty.application.dto;

import io.github.riemr.duty.application.util.DutyCalendar;
import io.github.riemr.duty.domain.model.DutyAssignment;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 割当実行の結果。
 *
 * @param mode            使用した方式
 * @param assignments     割当できた日（時系列順）
 * @param unassignedDates 候補がいなかった日。手動割当が必要
 */
public record AssignmentResult(String mode, List<DutyAssignment> assignments, List<LocalDate> unassignedDates) {

    public AssignmentResult {
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
        unassignedDates = unassignedDates == null ? List.of() : List.copyOf(unassignedDates);
    }

    /** yyyy-MM-dd → memberId */
    public Map<String, String> toDateMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (DutyAssignment a : assignments) {
            map.put(DutyCalendar.format(a.date()), a.memberId());
        }
        return map;
    }
}
