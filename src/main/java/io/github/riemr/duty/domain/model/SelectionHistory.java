package io.github.riemr.duty.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SelectionHistory {
    private String id;
    private String organizationId;
    private String stableId;
    private String processId;
    private String processName;
    private String algorithm;
    @Builder.Default
    private List<SelectionHistoryTurn> finalTurnOrder = new ArrayList<>();
    private Instant completedAt;
}
