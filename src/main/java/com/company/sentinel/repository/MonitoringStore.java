package com.company.sentinel.repository;

import com.company.sentinel.domain.CheckResult;
import com.company.sentinel.domain.DailyStat;
import com.company.sentinel.domain.TargetConfig;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence seen by the probing pipeline and the retention aggregator
 */
public interface MonitoringStore {

    /**
     * Idempotent by (targetId, checkedAt).
     *
     * @return true if stored, false if a result with the same key already existed
     */
    boolean insertResult(CheckResult result);

    /**
     * Additive merge into the row for (targetId, dayDate)
     */
    void upsertDailyStat(DailyStat stat);

    /**
     * @return number of raw results deleted
     */
    int deleteResultsBefore(Instant cutoff);

    List<CheckResult> selectResultsInRange(Instant fromInclusive, Instant toExclusive);

    /**
     * Per-target, per-day aggregates of raw results, days taken in the given zone
     */
    List<DailyStat> summarizeResultsInRange(Instant fromInclusive, Instant toExclusive, ZoneId zone);

    Optional<Instant> findOldestResultTime();

    Optional<LocalDate> findLastSummarizedDay();

    /**
     * Atomically record the day in the summarized-day ledger and merge its
     * stats. Nothing is written if the day is already in the ledger.
     *
     * @return false if the day had already been committed
     */
    boolean commitSummarizedDay(LocalDate day, List<DailyStat> stats);

    List<DailyStat> findDailyStats(long targetId, LocalDate fromInclusive, LocalDate toInclusive);

    /**
     * Store or refresh a target by url
     *
     * @return the id assigned to it
     */
    long registerTarget(TargetConfig target);

    /**
     * @return number of stored targets switched to inactive
     */
    int deactivateTargetsExcept(Collection<Long> keptIds);
}
