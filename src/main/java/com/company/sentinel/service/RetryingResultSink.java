package com.company.sentinel.service;

import com.company.sentinel.domain.CheckResult;
import com.company.sentinel.repository.MonitoringStore;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes results to the store, retrying storage failures with exponential
 * backoff. A result that still cannot be written is dropped and counted.
 */
@Slf4j
public class RetryingResultSink implements ResultSink {

    private final MonitoringStore store;
    private final Retry retry;
    private final Counter recorded;
    private final Counter duplicates;
    private final Counter dropped;
    private final AtomicLong droppedTotal = new AtomicLong();

    public RetryingResultSink(MonitoringStore store, MeterRegistry meterRegistry,
                              int maxAttempts, Duration backoff) {
        this.store = store;
        this.retry = Retry.of("result-sink", RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(backoff, 2.0))
                .retryExceptions(DataAccessException.class)
                .ignoreExceptions(DuplicateKeyException.class)
                .build());
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Storage write failed (attempt {}), retrying in {}: {}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));

        this.recorded = meterRegistry.counter("sentinel.results.recorded");
        this.duplicates = meterRegistry.counter("sentinel.results.duplicate");
        this.dropped = meterRegistry.counter("sentinel.results.dropped");
    }

    @Override
    public boolean record(CheckResult result) {
        try {
            boolean stored = Retry.decorateSupplier(retry, () -> store.insertResult(result)).get();
            if (stored) {
                recorded.increment();
            } else {
                duplicates.increment();
                log.debug("Result for target {} at {} already stored", result.getTargetId(), result.getCheckedAt());
            }
            return stored;
        } catch (DuplicateKeyException e) {
            duplicates.increment();
            log.debug("Result for target {} at {} already stored", result.getTargetId(), result.getCheckedAt());
            return false;
        } catch (RuntimeException e) {
            log.error("Dropping result for target {} at {} after {} attempt(s)",
                    result.getTargetId(), result.getCheckedAt(), retry.getRetryConfig().getMaxAttempts(), e);
            countDropped();
            return false;
        }
    }

    @Override
    public void markDropped(CheckResult result, String reason) {
        log.error("Dropping result for target {} at {} before it reached storage: {}",
                result.getTargetId(), result.getCheckedAt(), reason);
        countDropped();
    }

    private void countDropped() {
        dropped.increment();
        droppedTotal.incrementAndGet();
    }

    /**
     * Results given up on since startup
     */
    public long droppedCount() {
        return droppedTotal.get();
    }
}
