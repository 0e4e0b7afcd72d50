package io.github.riemr.duty.selection;

import java.util.List;

/**
 * @param selectionStartDate yyyy-MM-dd
 * @param selectionEndDate   yyyy-MM-dd
 */
public record TurnOrderRequest(String stableId, String organizationId, String algorithm,
                               List<String> memberIds, String selectionStartDate, String selectionEndDate) {

    public TurnOrderRequest {
        memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
    }
}
