package com.company.sentinel.scheduler;

import com.company.sentinel.domain.CheckResult;
import com.company.sentinel.domain.TargetConfig;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.Future;

/**
 * Scheduling state of one target. Only the coordinating loop touches it.
 */
@Getter
class ScheduledTarget {

    private TargetConfig config;
    private long intervalNanos;
    private long nextDueAt;
    private Future<CheckResult> inFlight;
    private long dispatchedAtNanos;
    private Instant lastDispatchedAt;
    private long dispatchCount;
    private long errorCount;
    private long missedSlots;

    ScheduledTarget(TargetConfig config, long firstDueAt) {
        this.config = config;
        this.intervalNanos = config.getInterval().toNanos();
        this.nextDueAt = firstDueAt;
    }

    long getTargetId() {
        return config.getId();
    }

    boolean isInFlight() {
        return inFlight != null;
    }

    boolean isDue(long now) {
        return now - nextDueAt >= 0;
    }

    /**
     * Record a dispatch and advance the due time from the previous due time,
     * never from now. Slots that already passed are skipped, so a late tick
     * delays one probe without shifting the cadence.
     */
    void markDispatched(Future<CheckResult> future, long now, Instant wallClock) {
        inFlight = future;
        dispatchedAtNanos = now;
        lastDispatchedAt = wallClock;
        dispatchCount++;

        nextDueAt += intervalNanos;
        if (now - nextDueAt >= 0) {
            long behind = (now - nextDueAt) / intervalNanos + 1;
            nextDueAt += behind * intervalNanos;
            missedSlots += behind;
        }
    }

    Future<CheckResult> clearInFlight() {
        Future<CheckResult> done = inFlight;
        inFlight = null;
        return done;
    }

    void recordOutcome(CheckResult result) {
        if (!result.isSuccess()) {
            errorCount++;
        }
    }

    /**
     * Swap in a reloaded config for the same target id, keeping its cadence
     */
    void reconfigure(TargetConfig updated) {
        long updatedInterval = updated.getInterval().toNanos();
        if (updatedInterval != intervalNanos) {
            nextDueAt = nextDueAt - intervalNanos + updatedInterval;
            intervalNanos = updatedInterval;
        }
        config = updated;
    }

    TargetScheduleStatus toStatus() {
        return TargetScheduleStatus.builder()
                .targetId(config.getId())
                .url(config.getUrl())
                .intervalSeconds(config.getIntervalSeconds())
                .active(config.isActive())
                .inFlight(isInFlight())
                .lastDispatchedAt(lastDispatchedAt)
                .dispatchCount(dispatchCount)
                .errorCount(errorCount)
                .missedSlots(missedSlots)
                .build();
    }
}
