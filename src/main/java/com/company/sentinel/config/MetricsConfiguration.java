package com.company.sentinel.config;

import com.company.sentinel.executor.ExecutorBackend;
import com.company.sentinel.scheduler.ProbeScheduler;
import com.company.sentinel.service.RetryingResultSink;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific gauges
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final ProbeScheduler probeScheduler;
    private final ExecutorBackend executorBackend;
    private final RetryingResultSink resultSink;

    @Bean
    public MeterBinder sentinelMetrics() {
        return (reg) -> {
            Gauge.builder("sentinel.scheduler.targets.active", probeScheduler,
                            scheduler -> scheduler.getStatus().getActiveTargets())
                    .description("Active targets in the current target set")
                    .register(reg);

            Gauge.builder("sentinel.scheduler.in_flight", probeScheduler,
                            scheduler -> scheduler.getStatus().getInFlight())
                    .description("Probes dispatched and not yet harvested")
                    .register(reg);

            Gauge.builder("sentinel.executor.pending", executorBackend, ExecutorBackend::pendingTasks)
                    .description("Tasks accepted by the executor backend and not yet completed")
                    .tag("backend", executorBackend.name())
                    .register(reg);

            Gauge.builder("sentinel.sink.dropped.count", resultSink, RetryingResultSink::droppedCount)
                    .description("Results dropped after exhausting storage retries since startup")
                    .register(reg);

            log.info("Sentinel metrics registered");
        };
    }
}
