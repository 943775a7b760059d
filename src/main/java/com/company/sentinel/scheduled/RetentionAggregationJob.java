package com.company.sentinel.scheduled;

import com.company.sentinel.domain.RetentionCycleReport;
import com.company.sentinel.exception.RetentionCycleException;
import com.company.sentinel.service.RetentionAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "sentinel.retention.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class RetentionAggregationJob {

    private final RetentionAggregator aggregator;

    /**
     * Summarize and purge raw results past the retention window, daily at 00:15 by default
     */
    @Scheduled(
            cron = "${sentinel.retention.cron:0 15 0 * * *}",
            zone = "${sentinel.retention.zone:UTC}"
    )
    public void runRetention() {
        try {
            RetentionCycleReport report = aggregator.runCycle();
            log.debug("Retention job finished: {}", report.getStatus().getDescription());
        } catch (RetentionCycleException e) {
            log.warn("Retention job will retry {} on its next run", e.getFailedDay());
        } catch (DataAccessException e) {
            log.warn("Retention job will retry the purge on its next run");
        }
    }
}
