package io.github.riemr.duty.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 日付が決まっている当番枠。assignedTo が null なら未割当。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenDuty {
    private String stableId;
    private LocalDate scheduledDate;
    private double pointsValue;
    private String assignedTo;

    public boolean isUnassigned() {
        return assignedTo == null || assignedTo.isBlank();
    }
}
