package io.github.riemr.duty.application.repository;

import io.github.riemr.duty.domain.model.CompletedDuty;
import io.github.riemr.duty.domain.model.OpenDuty;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * 当番の実績（完了分）と予定枠（未割当を含む）。
 */
public interface DutyLedgerRepository {
    List<CompletedDuty> findCompletedSince(String stableId, Instant cutoff);

    /** from, to とも含む */
    List<OpenDuty> findUnassignedBetween(String stableId, LocalDate from, LocalDate to);

    void saveCompleted(CompletedDuty duty);

    void saveOpen(OpenDuty duty);
}
