package io.github.riemr.duty.application.dto;

import io.github.riemr.duty.domain.model.MemberForAssignment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 1回の割当実行の入力。dates は時系列順であること。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentRequest {
    @Builder.Default
    private List<LocalDate> dates = new ArrayList<>();
    @Builder.Default
    private List<MemberForAssignment> members = new ArrayList<>();
    private LocalTime scheduledStartTime;
    private double pointsValue; // 1回分の付与ポイント
}
