package com.company.sentinel.domain;

import lombok.*;

import java.io.Serializable;
import java.time.LocalDate;

/**
 * Daily rollup of raw results for one target.
 * Unique per (targetId, dayDate); merges are additive.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DailyStat implements Serializable {
    private static final long serialVersionUID = 1L;

    private long targetId;
    private LocalDate dayDate;
    private int totalChecks;
    private int successfulChecks;
    private int failureCount;

    // Checks that carried a response time; weight of avgResponseTimeMs
    private int timedChecks;
    private Double avgResponseTimeMs;
    private Double minResponseTimeMs;
    private Double maxResponseTimeMs;

    /**
     * Combine this row with an incoming delta for the same (target, day).
     * Counts add up, the average is recombined as a weighted mean.
     */
    public DailyStat mergedWith(DailyStat delta) {
        if (delta.getTargetId() != targetId || !delta.getDayDate().equals(dayDate)) {
            throw new IllegalArgumentException("Cannot merge stats of "
                    + delta.getTargetId() + "/" + delta.getDayDate()
                    + " into " + targetId + "/" + dayDate);
        }

        int timed = timedChecks + delta.getTimedChecks();
        Double avg = null;
        if (timed > 0) {
            avg = (valueOf(avgResponseTimeMs) * timedChecks
                    + valueOf(delta.getAvgResponseTimeMs()) * delta.getTimedChecks()) / timed;
        }

        return DailyStat.builder()
                .targetId(targetId)
                .dayDate(dayDate)
                .totalChecks(totalChecks + delta.getTotalChecks())
                .successfulChecks(successfulChecks + delta.getSuccessfulChecks())
                .failureCount(failureCount + delta.getFailureCount())
                .timedChecks(timed)
                .avgResponseTimeMs(avg)
                .minResponseTimeMs(least(minResponseTimeMs, delta.getMinResponseTimeMs()))
                .maxResponseTimeMs(greatest(maxResponseTimeMs, delta.getMaxResponseTimeMs()))
                .build();
    }

    private static double valueOf(Double value) {
        return value != null ? value : 0.0;
    }

    private static Double least(Double a, Double b) {
        if (a == null) return b;
        if (b == null) return a;
        return Math.min(a, b);
    }

    private static Double greatest(Double a, Double b) {
        if (a == null) return b;
        if (b == null) return a;
        return Math.max(a, b);
    }
}
