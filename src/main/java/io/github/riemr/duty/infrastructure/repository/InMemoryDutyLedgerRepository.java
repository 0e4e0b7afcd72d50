package io.github.riemr.duty.infrastructure.repository;

import io.github.riemr.duty.application.repository.DutyLedgerRepository;
import io.github.riemr.duty.domain.model.CompletedDuty;
import io.github.riemr.duty.domain.model.OpenDuty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
public class InMemoryDutyLedgerRepository implements DutyLedgerRepository {

    private final List<CompletedDuty> completed = new CopyOnWriteArrayList<>();
    private final List<OpenDuty> open = new CopyOnWriteArrayList<>();

    @Override
    public List<CompletedDuty> findCompletedSince(String stableId, Instant cutoff) {
        return completed.stream()
                .filter(d -> d.getStableId() != null && d.getStableId().equals(stableId))
                .filter(d -> d.getCompletedAt() != null && !d.getCompletedAt().isBefore(cutoff))
                .toList();
    }

    @Override
    public List<OpenDuty> findUnassignedBetween(String stableId, LocalDate from, LocalDate to) {
        return open.stream()
                .filter(d -> d.getStableId() != null && d.getStableId().equals(stableId))
                .filter(OpenDuty::isUnassigned)
                .filter(d -> d.getScheduledDate() != null
                        && !d.getScheduledDate().isBefore(from)
                        && !d.getScheduledDate().isAfter(to))
                .toList();
    }

    @Override
    public void saveCompleted(CompletedDuty duty) {
        completed.add(duty);
    }

    @Override
    public void saveOpen(OpenDuty duty) {
        open.add(duty);
    }
}
