package com.company.sentinel.scheduler;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Point-in-time view of the scheduler, published once per tick
 */
@Value
@Builder
public class SchedulerStatus {

    public static final SchedulerStatus EMPTY = SchedulerStatus.builder().build();

    boolean running;
    String backend;
    int maxConcurrency;
    int totalTargets;
    int activeTargets;
    int inFlight;
    @Builder.Default
    List<TargetScheduleStatus> targets = Collections.emptyList();
}
