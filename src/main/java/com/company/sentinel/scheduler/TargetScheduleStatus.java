package com.company.sentinel.scheduler;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class TargetScheduleStatus {
    long targetId;
    String url;
    int intervalSeconds;
    boolean active;
    boolean inFlight;
    Instant lastDispatchedAt;
    long dispatchCount;
    long errorCount;
    long missedSlots;
}
