package com.company.sentinel.domain;

import com.company.sentinel.domain.enums.CycleStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class RetentionCycleReport {
    CycleStatus status;
    Instant cutoff;
    int daysSummarized;
    int daysAlreadySummarized;
    int statsUpserted;
    int resultsPurged;

    public static RetentionCycleReport skipped() {
        return RetentionCycleReport.builder()
                .status(CycleStatus.SKIPPED_LOCKED)
                .build();
    }
}
