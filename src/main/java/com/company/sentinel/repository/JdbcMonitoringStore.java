package com.company.sentinel.repository;

import com.company.sentinel.domain.CheckResult;
import com.company.sentinel.domain.DailyStat;
import com.company.sentinel.domain.TargetConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class JdbcMonitoringStore implements MonitoringStore {

    private final CheckResultRepository resultRepository;
    private final DailyStatRepository statRepository;
    private final SummarizedDayRepository summarizedDayRepository;
    private final TargetRepository targetRepository;

    @Override
    public boolean insertResult(CheckResult result) {
        return resultRepository.insert(result);
    }

    @Override
    public void upsertDailyStat(DailyStat stat) {
        statRepository.upsert(stat);
    }

    @Override
    public int deleteResultsBefore(Instant cutoff) {
        return resultRepository.deleteBefore(cutoff);
    }

    @Override
    public List<CheckResult> selectResultsInRange(Instant fromInclusive, Instant toExclusive) {
        return resultRepository.findInRange(fromInclusive, toExclusive);
    }

    @Override
    public List<DailyStat> summarizeResultsInRange(Instant fromInclusive, Instant toExclusive, ZoneId zone) {
        return statRepository.summarizeResults(fromInclusive, toExclusive, zone);
    }

    @Override
    public Optional<Instant> findOldestResultTime() {
        return resultRepository.findOldestCheckedAt();
    }

    @Override
    public Optional<LocalDate> findLastSummarizedDay() {
        return summarizedDayRepository.findLastDay();
    }

    /**
     * The ledger row is claimed first, so a concurrent or repeated commit of
     * the same day finds the conflict and writes no stats
     */
    @Override
    @Transactional
    public boolean commitSummarizedDay(LocalDate day, List<DailyStat> stats) {
        if (!summarizedDayRepository.markSummarized(day, stats.size())) {
            log.info("Day {} already summarized, skipping {} stat row(s)", day, stats.size());
            return false;
        }
        for (DailyStat stat : stats) {
            if (!day.equals(stat.getDayDate())) {
                throw new IllegalArgumentException("Stat for " + stat.getDayDate()
                        + " committed under day " + day);
            }
            statRepository.upsert(stat);
        }
        return true;
    }

    @Override
    public List<DailyStat> findDailyStats(long targetId, LocalDate fromInclusive, LocalDate toInclusive) {
        return statRepository.findByTarget(targetId, fromInclusive, toInclusive);
    }

    @Override
    public long registerTarget(TargetConfig target) {
        return targetRepository.upsert(target);
    }

    @Override
    @Transactional
    public int deactivateTargetsExcept(Collection<Long> keptIds) {
        return targetRepository.deactivateAllExcept(keptIds);
    }
}
