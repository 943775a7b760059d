package com.company.sentinel.executor;

import com.company.sentinel.domain.CheckResult;
import com.company.sentinel.exception.CapacityExceededException;
import com.company.sentinel.service.Probe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fixed worker pool with a bounded queue in front of it
 */
@Slf4j
public class LocalExecutorBackend implements ExecutorBackend {

    private final Probe probe;
    private final int maxConcurrency;
    private final ThreadPoolExecutor pool;

    public LocalExecutorBackend(Probe probe, int maxConcurrency, int queueDepth) {
        this.probe = probe;
        this.maxConcurrency = maxConcurrency;
        this.pool = new ThreadPoolExecutor(
                maxConcurrency,
                maxConcurrency,
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueDepth),
                new CustomizableThreadFactory("probe-worker-"),
                new ThreadPoolExecutor.AbortPolicy());

        log.info("Local executor backend ready: {} workers, queue depth {}", maxConcurrency, queueDepth);
    }

    @Override
    public Future<CheckResult> submit(ProbeTask task) {
        try {
            return pool.submit(() -> probe.check(task.getTarget()));
        } catch (RejectedExecutionException e) {
            throw new CapacityExceededException("Local pool saturated: "
                    + pool.getActiveCount() + " running, " + pool.getQueue().size() + " queued", e);
        }
    }

    @Override
    public int maxConcurrency() {
        return maxConcurrency;
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public int pendingTasks() {
        return pool.getActiveCount() + pool.getQueue().size();
    }

    @Override
    public void shutdown(Duration grace) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = pool.shutdownNow();
                log.warn("Probe workers did not finish within {}, forced shutdown dropped {} queued task(s)",
                        grace, dropped.size());
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
