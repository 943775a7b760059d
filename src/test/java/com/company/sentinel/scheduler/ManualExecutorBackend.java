package com.company.sentinel.scheduler;

import com.company.sentinel.domain.CheckResult;
import com.company.sentinel.exception.CapacityExceededException;
import com.company.sentinel.executor.ExecutorBackend;
import com.company.sentinel.executor.ProbeTask;
import com.company.sentinel.util.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * Backend whose tasks complete only when the test completes them, or
 * immediately when auto-complete is on
 */
class ManualExecutorBackend implements ExecutorBackend {

    private final Ticker ticker;
    private final int capacity;
    private boolean autoComplete;
    private boolean shutDown;

    final List<Submission> submissions = new ArrayList<>();

    ManualExecutorBackend(Ticker ticker, int capacity) {
        this.ticker = ticker;
        this.capacity = capacity;
    }

    ManualExecutorBackend autoComplete() {
        this.autoComplete = true;
        return this;
    }

    @Override
    public Future<CheckResult> submit(ProbeTask task) {
        if (pendingTasks() >= capacity) {
            throw new CapacityExceededException("full");
        }
        CompletableFuture<CheckResult> future = new CompletableFuture<>();
        submissions.add(new Submission(task, ticker.nanoTime(), future));
        if (autoComplete) {
            future.complete(successFor(task));
        }
        return future;
    }

    static CheckResult successFor(ProbeTask task) {
        return CheckResult.builder()
                .targetId(task.getTargetId())
                .checkedAt(task.getDispatchedAt())
                .success(true)
                .httpStatus(200)
                .responseTimeMs(12.5)
                .build();
    }

    @Override
    public int maxConcurrency() {
        return capacity;
    }

    @Override
    public String name() {
        return "manual";
    }

    @Override
    public int pendingTasks() {
        return (int) submissions.stream().filter(s -> !s.future.isDone()).count();
    }

    @Override
    public void shutdown(Duration grace) {
        shutDown = true;
    }

    boolean isShutDown() {
        return shutDown;
    }

    long countFor(long targetId) {
        return submissions.stream().filter(s -> s.task.getTargetId() == targetId).count();
    }

    Submission last() {
        return submissions.get(submissions.size() - 1);
    }

    static class Submission {
        final ProbeTask task;
        final long submittedAt;
        final CompletableFuture<CheckResult> future;

        Submission(ProbeTask task, long submittedAt, CompletableFuture<CheckResult> future) {
            this.task = task;
            this.submittedAt = submittedAt;
            this.future = future;
        }
    }
}
