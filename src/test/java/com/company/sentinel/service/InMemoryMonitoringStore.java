package com.company.sentinel.service;

import com.company.sentinel.domain.CheckResult;
import com.company.sentinel.domain.DailyStat;
import com.company.sentinel.domain.TargetConfig;
import com.company.sentinel.repository.MonitoringStore;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Store with the same keying and merge rules as the JDBC one, plus hooks to
 * make individual operations fail
 */
class InMemoryMonitoringStore implements MonitoringStore {

    final Map<String, CheckResult> results = new LinkedHashMap<>();
    final Map<String, DailyStat> stats = new LinkedHashMap<>();
    final TreeSet<LocalDate> ledger = new TreeSet<>();
    final Map<String, Long> targetIds = new LinkedHashMap<>();
    final Set<Long> activeTargets = new HashSet<>();

    int insertFailuresRemaining;
    int insertCalls;
    LocalDate failCommitOn;
    boolean failPurge;

    private static String resultKey(long targetId, Instant checkedAt) {
        return targetId + "@" + checkedAt;
    }

    private static String statKey(long targetId, LocalDate day) {
        return targetId + "@" + day;
    }

    @Override
    public synchronized boolean insertResult(CheckResult result) {
        insertCalls++;
        if (insertFailuresRemaining > 0) {
            insertFailuresRemaining--;
            throw new DataAccessResourceFailureException("database unavailable");
        }
        return results.putIfAbsent(resultKey(result.getTargetId(), result.getCheckedAt()), result) == null;
    }

    @Override
    public synchronized void upsertDailyStat(DailyStat stat) {
        stats.merge(statKey(stat.getTargetId(), stat.getDayDate()), stat, DailyStat::mergedWith);
    }

    @Override
    public synchronized int deleteResultsBefore(Instant cutoff) {
        if (failPurge) {
            throw new DataAccessResourceFailureException("purge failed");
        }
        int before = results.size();
        results.values().removeIf(r -> r.getCheckedAt().isBefore(cutoff));
        return before - results.size();
    }

    @Override
    public synchronized List<CheckResult> selectResultsInRange(Instant fromInclusive, Instant toExclusive) {
        return results.values().stream()
                .filter(r -> !r.getCheckedAt().isBefore(fromInclusive) && r.getCheckedAt().isBefore(toExclusive))
                .sorted(Comparator.comparing(CheckResult::getCheckedAt))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<DailyStat> summarizeResultsInRange(Instant fromInclusive, Instant toExclusive, ZoneId zone) {
        Map<String, DailyStat> summary = new LinkedHashMap<>();
        for (CheckResult r : selectResultsInRange(fromInclusive, toExclusive)) {
            LocalDate day = r.getCheckedAt().atZone(zone).toLocalDate();
            boolean timed = r.getResponseTimeMs() != null;
            DailyStat single = DailyStat.builder()
                    .targetId(r.getTargetId())
                    .dayDate(day)
                    .totalChecks(1)
                    .successfulChecks(r.isSuccess() ? 1 : 0)
                    .failureCount(r.isSuccess() ? 0 : 1)
                    .timedChecks(timed ? 1 : 0)
                    .avgResponseTimeMs(r.getResponseTimeMs())
                    .minResponseTimeMs(r.getResponseTimeMs())
                    .maxResponseTimeMs(r.getResponseTimeMs())
                    .build();
            summary.merge(statKey(r.getTargetId(), day), single, DailyStat::mergedWith);
        }
        return new ArrayList<>(summary.values());
    }

    @Override
    public synchronized Optional<Instant> findOldestResultTime() {
        return results.values().stream().map(CheckResult::getCheckedAt).min(Comparator.naturalOrder());
    }

    @Override
    public synchronized Optional<LocalDate> findLastSummarizedDay() {
        return ledger.isEmpty() ? Optional.empty() : Optional.of(ledger.last());
    }

    @Override
    public synchronized boolean commitSummarizedDay(LocalDate day, List<DailyStat> dayStats) {
        if (ledger.contains(day)) {
            return false;
        }
        if (day.equals(failCommitOn)) {
            throw new DataAccessResourceFailureException("commit of " + day + " failed");
        }
        dayStats.forEach(this::upsertDailyStat);
        ledger.add(day);
        return true;
    }

    @Override
    public synchronized List<DailyStat> findDailyStats(long targetId, LocalDate fromInclusive, LocalDate toInclusive) {
        return stats.values().stream()
                .filter(s -> s.getTargetId() == targetId)
                .filter(s -> !s.getDayDate().isBefore(fromInclusive) && !s.getDayDate().isAfter(toInclusive))
                .sorted(Comparator.comparing(DailyStat::getDayDate))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized long registerTarget(TargetConfig target) {
        long id = targetIds.computeIfAbsent(target.getUrl(), url -> (long) targetIds.size() + 100);
        if (target.isActive()) {
            activeTargets.add(id);
        } else {
            activeTargets.remove(id);
        }
        return id;
    }

    @Override
    public synchronized int deactivateTargetsExcept(Collection<Long> keptIds) {
        int before = activeTargets.size();
        activeTargets.retainAll(keptIds);
        return before - activeTargets.size();
    }
}
