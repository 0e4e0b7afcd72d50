package io.github.riemr.duty.optimization.config;

/**
 * 割当方式。{@link LegacyScoring} か {@link RankedRoundRobin} のどちらか。
 * オーケストレータの入口で一度だけ決定する。
 */
public interface AssignmentMode {

    String label();
}
