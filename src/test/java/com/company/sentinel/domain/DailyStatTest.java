package com.company.sentinel.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DailyStatTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    private static DailyStat stat(int total, int timed, Double avg, Double min, Double max) {
        return DailyStat.builder()
                .targetId(7)
                .dayDate(DAY)
                .totalChecks(total)
                .successfulChecks(total - 1)
                .failureCount(1)
                .timedChecks(timed)
                .avgResponseTimeMs(avg)
                .minResponseTimeMs(min)
                .maxResponseTimeMs(max)
                .build();
    }

    @Test
    void averageIsWeightedByTimedChecks() {
        DailyStat merged = stat(4, 3, 100.0, 80.0, 120.0).mergedWith(stat(2, 1, 300.0, 300.0, 300.0));

        assertThat(merged.getTotalChecks()).isEqualTo(6);
        assertThat(merged.getSuccessfulChecks()).isEqualTo(4);
        assertThat(merged.getFailureCount()).isEqualTo(2);
        assertThat(merged.getTimedChecks()).isEqualTo(4);
        assertThat(merged.getAvgResponseTimeMs()).isEqualTo(150.0);
        assertThat(merged.getMinResponseTimeMs()).isEqualTo(80.0);
        assertThat(merged.getMaxResponseTimeMs()).isEqualTo(300.0);
    }

    @Test
    void untimedDeltaLeavesTimingsAlone() {
        DailyStat merged = stat(3, 2, 50.0, 40.0, 60.0).mergedWith(stat(1, 0, null, null, null));

        assertThat(merged.getTotalChecks()).isEqualTo(4);
        assertThat(merged.getAvgResponseTimeMs()).isEqualTo(50.0);
        assertThat(merged.getMinResponseTimeMs()).isEqualTo(40.0);
        assertThat(merged.getMaxResponseTimeMs()).isEqualTo(60.0);
    }

    @Test
    void noTimedChecksOnEitherSideGivesNoAverage() {
        DailyStat merged = stat(1, 0, null, null, null).mergedWith(stat(2, 0, null, null, null));

        assertThat(merged.getTimedChecks()).isZero();
        assertThat(merged.getAvgResponseTimeMs()).isNull();
    }

    @Test
    void refusesToMergeAnotherDay() {
        DailyStat other = stat(1, 0, null, null, null).toBuilder().dayDate(DAY.plusDays(1)).build();

        assertThatThrownBy(() -> stat(1, 0, null, null, null).mergedWith(other))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
