package io.github.riemr.duty.infrastructure.repository;

import io.github.riemr.duty.application.repository.SelectionHistoryRepository;
import io.github.riemr.duty.domain.model.SelectionHistory;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
public class InMemorySelectionHistoryRepository implements SelectionHistoryRepository {

    private final Map<String, List<SelectionHistory>> byStable = new ConcurrentHashMap<>();

    @Override
    public Optional<SelectionHistory> findLastCompleted(String stableId) {
        if (stableId == null) return Optional.empty();
        return byStable.getOrDefault(stableId, List.of()).stream()
                .filter(h -> h.getCompletedAt() != null)
                .max(Comparator.comparing(SelectionHistory::getCompletedAt));
    }

    @Override
    public SelectionHistory save(SelectionHistory history) {
        if (history.getId() == null) history.setId(UUID.randomUUID().toString());
        Objects.requireNonNull(history.getCompletedAt(), "completedAt");
        byStable.computeIfAbsent(history.getStableId(), k -> new CopyOnWriteArrayList<>()).add(history);
        return history;
    }
}
