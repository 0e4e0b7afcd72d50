package io.github.riemr.duty.application.repository;

import io.github.riemr.duty.domain.model.SelectionHistory;

import java.util.Optional;

public interface SelectionHistoryRepository {
    /** completedAt が最も新しい履歴 */
    Optional<SelectionHistory> findLastCompleted(String stableId);

    SelectionHistory save(SelectionHistory history);
}
