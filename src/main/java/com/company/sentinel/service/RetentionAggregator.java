package com.company.sentinel.service;

import com.company.sentinel.domain.DailyStat;
import com.company.sentinel.domain.RetentionCycleReport;
import com.company.sentinel.domain.enums.CycleStatus;
import com.company.sentinel.exception.RetentionCycleException;
import com.company.sentinel.repository.MonitoringStore;
import com.company.sentinel.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Folds raw results older than the retention window into daily stats, then
 * purges them.
 * <p>
 * Days are summarized one at a time, each committed together with its entry
 * in the summarized-day ledger. A day already in the ledger is never merged
 * again, so a cycle that failed halfway can simply be rerun. The purge only
 * runs once every day before the cutoff is in the ledger.
 */
@Slf4j
public class RetentionAggregator {

    private final MonitoringStore store;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Duration keepRaw;
    private final ZoneId zone;
    private final ReentrantLock runLock = new ReentrantLock();

    public RetentionAggregator(MonitoringStore store, Clock clock, MeterRegistry meterRegistry,
                               Duration keepRaw, ZoneId zone) {
        this.store = store;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.keepRaw = keepRaw;
        this.zone = zone;
    }

    /**
     * Run one summarize-then-purge cycle, or skip it if another one holds the lock.
     *
     * @throws RetentionCycleException if a day could not be summarized; nothing was purged
     */
    public RetentionCycleReport runCycle() {
        if (!runLock.tryLock()) {
            log.warn("Retention cycle already running, skipping this one");
            meterRegistry.counter("sentinel.retention.cycles", "outcome", "skipped").increment();
            return RetentionCycleReport.skipped();
        }

        try {
            return summarizeAndPurge();
        } finally {
            runLock.unlock();
        }
    }

    private RetentionCycleReport summarizeAndPurge() {
        Instant startedAt = clock.instant();
        LocalDate cutoffDay = TimeUtils.retentionCutoffDay(startedAt, keepRaw, zone);
        Instant cutoff = TimeUtils.startOfDay(cutoffDay, zone);

        LocalDate firstDay = firstDayToSummarize(cutoffDay);
        log.info("Starting retention cycle: summarizing {} to {} (exclusive), purging before {}",
                firstDay, cutoffDay, cutoff);

        int summarized = 0;
        int alreadySummarized = 0;
        int statsUpserted = 0;

        for (LocalDate day = firstDay; day.isBefore(cutoffDay); day = day.plusDays(1)) {
            try {
                List<DailyStat> stats = store.summarizeResultsInRange(
                        TimeUtils.startOfDay(day, zone), TimeUtils.startOfDay(day.plusDays(1), zone), zone);

                if (store.commitSummarizedDay(day, stats)) {
                    summarized++;
                    statsUpserted += stats.size();
                    log.debug("Summarized {} into {} stat row(s)", day, stats.size());
                } else {
                    alreadySummarized++;
                }
            } catch (RuntimeException e) {
                meterRegistry.counter("sentinel.retention.cycles", "outcome", "failed").increment();
                log.error("Retention cycle aborted at {} after {} day(s) summarized, raw results kept",
                        day, summarized, e);
                throw new RetentionCycleException(day, e);
            }
        }

        int purged;
        try {
            purged = store.deleteResultsBefore(cutoff);
        } catch (RuntimeException e) {
            // Summaries are committed and ledgered, the next cycle only retries the purge
            meterRegistry.counter("sentinel.retention.cycles", "outcome", "failed").increment();
            log.error("Failed to purge raw results before {}", cutoff, e);
            throw e;
        }

        meterRegistry.counter("sentinel.retention.cycles", "outcome", "completed").increment();
        meterRegistry.counter("sentinel.retention.days_summarized").increment(summarized);
        meterRegistry.counter("sentinel.retention.results_purged").increment(purged);

        long elapsedMs = Duration.between(startedAt, clock.instant()).toMillis();
        log.info("Retention cycle completed in {}: {} day(s) summarized, {} already done, {} stat row(s), {} result(s) purged",
                TimeUtils.formatDuration(elapsedMs), summarized, alreadySummarized, statsUpserted, purged);

        return RetentionCycleReport.builder()
                .status(CycleStatus.COMPLETED)
                .cutoff(cutoff)
                .daysSummarized(summarized)
                .daysAlreadySummarized(alreadySummarized)
                .statsUpserted(statsUpserted)
                .resultsPurged(purged)
                .build();
    }

    /**
     * Day after the last ledger entry, but never earlier than the day of the
     * oldest raw result. With no raw results there is nothing to summarize.
     */
    private LocalDate firstDayToSummarize(LocalDate cutoffDay) {
        Optional<Instant> oldest = store.findOldestResultTime();
        if (oldest.isEmpty()) {
            return cutoffDay;
        }

        LocalDate oldestDay = TimeUtils.dayOf(oldest.get(), zone);
        Optional<LocalDate> lastSummarized = store.findLastSummarizedDay();
        if (lastSummarized.isPresent() && !lastSummarized.get().isBefore(oldestDay)) {
            return lastSummarized.get().plusDays(1);
        }
        return oldestDay;
    }
}
