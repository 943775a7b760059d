package com.company.sentinel.scheduler;

import com.company.sentinel.domain.CheckResult;
import com.company.sentinel.domain.TargetConfig;
import com.company.sentinel.event.CheckCompletedEvent;
import com.company.sentinel.exception.CapacityExceededException;
import com.company.sentinel.executor.ExecutorBackend;
import com.company.sentinel.executor.ProbeTask;
import com.company.sentinel.service.ResultSink;
import com.company.sentinel.util.Sleeper;
import com.company.sentinel.util.Ticker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Coordinating loop of the probing pipeline.
 * <p>
 * A single thread runs {@link #tick()} at a fixed delay. Each tick applies a
 * pending target-set replacement, harvests finished probes without blocking,
 * abandons probes stuck past their allowance, and dispatches every due target
 * that has no probe in flight, in target-list order. Per-target state is only
 * touched from the tick, so it needs no locking.
 */
@Slf4j
public class ProbeScheduler implements SmartLifecycle {

    private final ExecutorBackend backend;
    private final ApplicationEventPublisher eventPublisher;
    private final ResultSink resultSink;
    private final Clock clock;
    private final Ticker ticker;
    private final Sleeper sleeper;
    private final Duration tickInterval;
    private final Duration maxInFlight;
    private final Duration shutdownGrace;

    private final Counter dispatched;
    private final Counter deferred;
    private final Counter abandoned;
    private final MeterRegistry meterRegistry;

    private final Map<Long, ScheduledTarget> targets = new LinkedHashMap<>();
    // Targets removed by a reload while a probe was still out
    private final List<ScheduledTarget> retiring = new ArrayList<>();
    private final AtomicReference<List<TargetConfig>> pendingTargets = new AtomicReference<>();

    private volatile SchedulerStatus status = SchedulerStatus.EMPTY;
    private volatile boolean dispatching = true;
    private volatile boolean running;
    private ScheduledExecutorService loop;

    public ProbeScheduler(ExecutorBackend backend, ApplicationEventPublisher eventPublisher,
                          ResultSink resultSink, MeterRegistry meterRegistry, Clock clock, Ticker ticker, Sleeper sleeper,
                          Duration tickInterval, Duration maxInFlight, Duration shutdownGrace) {
        this.backend = backend;
        this.eventPublisher = eventPublisher;
        this.resultSink = resultSink;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.ticker = ticker;
        this.sleeper = sleeper;
        this.tickInterval = tickInterval;
        this.maxInFlight = maxInFlight;
        this.shutdownGrace = shutdownGrace;

        this.dispatched = meterRegistry.counter("sentinel.scheduler.dispatched");
        this.deferred = meterRegistry.counter("sentinel.scheduler.deferred");
        this.abandoned = meterRegistry.counter("sentinel.scheduler.abandoned");
    }

    /**
     * Replace the whole target set. Safe to call from any thread; the new set
     * is applied at the start of the next tick, never partially.
     */
    public void replaceTargets(List<TargetConfig> newTargets) {
        pendingTargets.set(List.copyOf(newTargets));
        log.info("Queued replacement target set of {} target(s)", newTargets.size());
    }

    public SchedulerStatus getStatus() {
        return status;
    }

    /**
     * One pass of the coordinating loop. Must not be called concurrently.
     */
    public void tick() {
        applyPendingTargets();

        long now = ticker.nanoTime();
        harvestCompleted();
        abandonOverdue(now);
        if (dispatching) {
            dispatchDue(now);
        }

        publishStatus();
    }

    private void applyPendingTargets() {
        List<TargetConfig> replacement = pendingTargets.getAndSet(null);
        if (replacement == null) {
            return;
        }

        long now = ticker.nanoTime();
        Map<Long, ScheduledTarget> previous = new LinkedHashMap<>(targets);
        targets.clear();

        for (TargetConfig config : replacement) {
            ScheduledTarget existing = previous.remove(config.getId());
            if (existing != null) {
                existing.reconfigure(config);
                targets.put(config.getId(), existing);
            } else {
                targets.put(config.getId(), new ScheduledTarget(config, now));
            }
        }

        for (ScheduledTarget removed : previous.values()) {
            if (removed.isInFlight()) {
                retiring.add(removed);
            }
        }

        log.info("Applied target set: {} target(s), {} removed, {} removed target(s) still in flight",
                targets.size(), previous.size(), retiring.size());
    }

    private void harvestCompleted() {
        for (ScheduledTarget target : targets.values()) {
            if (target.isInFlight() && target.getInFlight().isDone()) {
                complete(target);
            }
        }

        Iterator<ScheduledTarget> it = retiring.iterator();
        while (it.hasNext()) {
            ScheduledTarget target = it.next();
            if (target.getInFlight().isDone()) {
                complete(target);
                it.remove();
            }
        }
    }

    private void complete(ScheduledTarget target) {
        Future<CheckResult> future = target.clearInFlight();
        CheckResult result = resultOf(target, future);
        target.recordOutcome(result);
        forward(result);
    }

    private CheckResult resultOf(ScheduledTarget target, Future<CheckResult> future) {
        try {
            CheckResult result = future.get();
            if (result == null) {
                return CheckResult.executorFailure(target.getTargetId(), clock.instant(),
                        "Executor returned no result");
            }
            return result;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Probe task for target {} failed in the executor: {}",
                    target.getTargetId(), cause.getMessage());
            return CheckResult.executorFailure(target.getTargetId(), clock.instant(),
                    cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (CancellationException e) {
            return CheckResult.executorFailure(target.getTargetId(), clock.instant(), "Probe task cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CheckResult.executorFailure(target.getTargetId(), clock.instant(), "Interrupted");
        }
    }

    private void forward(CheckResult result) {
        meterRegistry.counter("sentinel.scheduler.completed",
                "success", String.valueOf(result.isSuccess())).increment();
        try {
            eventPublisher.publishEvent(new CheckCompletedEvent(result));
        } catch (Exception e) {
            // Typically a full result-writer queue
            log.error("Failed to hand off result of target {}", result.getTargetId(), e);
            resultSink.markDropped(result, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * A probe out longer than the allowance is treated as lost: the task is
     * cancelled and a failure is recorded so the target becomes eligible again.
     */
    private void abandonOverdue(long now) {
        long allowance = maxInFlight.toNanos();
        for (ScheduledTarget target : targets.values()) {
            if (target.isInFlight() && now - target.getDispatchedAtNanos() > allowance) {
                Future<CheckResult> future = target.clearInFlight();
                future.cancel(true);
                abandoned.increment();

                log.warn("Abandoning probe of target {} after {} in flight", target.getTargetId(), maxInFlight);
                CheckResult result = CheckResult.executorFailure(target.getTargetId(), clock.instant(),
                        "Probe abandoned after " + maxInFlight.toSeconds() + "s in flight");
                target.recordOutcome(result);
                forward(result);
            }
        }
    }

    private void dispatchDue(long now) {
        for (ScheduledTarget target : targets.values()) {
            if (!target.getConfig().isActive() || target.isInFlight() || !target.isDue(now)) {
                continue;
            }

            ProbeTask task = ProbeTask.builder()
                    .target(target.getConfig())
                    .dispatchedAt(clock.instant())
                    .build();
            try {
                Future<CheckResult> future = backend.submit(task);
                target.markDispatched(future, now, task.getDispatchedAt());
                dispatched.increment();
            } catch (CapacityExceededException e) {
                // Stays due and not in flight, reconsidered on the next tick
                deferred.increment();
                log.debug("Deferring target {} and the rest of this tick: {}", target.getTargetId(), e.getMessage());
                return;
            }
        }
    }

    private void publishStatus() {
        List<TargetScheduleStatus> snapshot = new ArrayList<>(targets.size());
        int active = 0;
        int inFlight = retiring.size();
        for (ScheduledTarget target : targets.values()) {
            snapshot.add(target.toStatus());
            if (target.getConfig().isActive()) active++;
            if (target.isInFlight()) inFlight++;
        }

        status = SchedulerStatus.builder()
                .running(running)
                .backend(backend.name())
                .maxConcurrency(backend.maxConcurrency())
                .totalTargets(targets.size())
                .activeTargets(active)
                .inFlight(inFlight)
                .targets(snapshot)
                .build();
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            // An escaping exception would cancel the fixed-delay schedule
            log.error("Scheduler tick failed", e);
            meterRegistry.counter("sentinel.scheduler.tick_failures").increment();
        }
    }

    @Override
    public void start() {
        dispatching = true;
        running = true;
        loop = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("probe-scheduler-"));
        loop.scheduleWithFixedDelay(this::safeTick, 0, tickInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Probe scheduler started on {} backend (max concurrency {}, tick {})",
                backend.name(), backend.maxConcurrency(), tickInterval);
    }

    @Override
    public void stop() {
        log.info("Stopping probe scheduler, grace period {}", shutdownGrace);
        dispatching = false;
        if (loop != null) {
            loop.shutdown();
            try {
                if (!loop.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                    loop.shutdownNow();
                }
            } catch (InterruptedException e) {
                loop.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        drainInFlight();
        backend.shutdown(Duration.ZERO);
        running = false;
        publishStatus();
        log.info("Probe scheduler stopped");
    }

    /**
     * Let in-flight probes finish within the grace period so their results
     * are recorded, then abandon whatever is left
     */
    void drainInFlight() {
        long deadline = ticker.nanoTime() + shutdownGrace.toNanos();
        while (countInFlight() > 0 && ticker.nanoTime() - deadline < 0) {
            harvestCompleted();
            if (countInFlight() == 0) {
                break;
            }
            try {
                sleeper.sleep(Duration.ofMillis(Math.min(100, Math.max(1, tickInterval.toMillis()))));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        harvestCompleted();

        int remaining = countInFlight();
        if (remaining > 0) {
            log.warn("{} probe(s) still in flight after {} grace, cancelling", remaining, shutdownGrace);
            for (ScheduledTarget target : targets.values()) {
                if (target.isInFlight()) {
                    target.clearInFlight().cancel(true);
                }
            }
            retiring.forEach(target -> target.clearInFlight().cancel(true));
            retiring.clear();
        }
    }

    private int countInFlight() {
        int count = retiring.size();
        for (ScheduledTarget target : targets.values()) {
            if (target.isInFlight()) count++;
        }
        return count;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Stop before the executor and the result listeners go away
     */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1000;
    }
}
