package com.company.sentinel.executor;

import com.company.sentinel.domain.CheckResult;
import com.company.sentinel.exception.CapacityExceededException;

import java.time.Duration;
import java.util.concurrent.Future;

/**
 * Concurrency substrate that runs probes. A submitted task executes at most
 * once; under backend failure it may be dropped, and the returned future then
 * fails or never completes.
 */
public interface ExecutorBackend {

    /**
     * Never blocks waiting for capacity
     *
     * @throws CapacityExceededException when the backend cannot queue another task
     */
    Future<CheckResult> submit(ProbeTask task);

    int maxConcurrency();

    String name();

    /**
     * Tasks accepted but not yet completed, running or queued
     */
    int pendingTasks();

    /**
     * Stop accepting work, give running tasks up to the grace period, then force release
     */
    void shutdown(Duration grace);
}
