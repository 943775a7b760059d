package com.company.sentinel.config;

import com.company.sentinel.executor.ExecutorBackend;
import com.company.sentinel.repository.MonitoringStore;
import com.company.sentinel.scheduler.ProbeScheduler;
import com.company.sentinel.service.HttpProbe;
import com.company.sentinel.service.Probe;
import com.company.sentinel.service.ResultSink;
import com.company.sentinel.service.RetentionAggregator;
import com.company.sentinel.service.RetryingResultSink;
import com.company.sentinel.service.TargetLoader;
import com.company.sentinel.transport.HttpTransport;
import com.company.sentinel.transport.JdkHttpTransport;
import com.company.sentinel.util.Sleeper;
import com.company.sentinel.util.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring of the probing pipeline and the retention aggregator
 */
@Configuration
public class SentinelConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Ticker ticker() {
        return Ticker.system();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean
    public HttpTransport httpTransport(Ticker ticker, SentinelProperties properties) {
        SentinelProperties.Probe probe = properties.getProbe();
        return new JdkHttpTransport(ticker, probe.getMaxBodyChars(), probe.getUserAgent());
    }

    @Bean
    public Probe probe(HttpTransport transport, Clock clock, Ticker ticker, Sleeper sleeper,
                       Tracer tracer, SentinelProperties properties) {
        SentinelProperties.Probe probe = properties.getProbe();
        return new HttpProbe(transport, clock, ticker, sleeper, tracer,
                probe.getTimeout(), probe.getRetryLimit(), probe.getRetryBackoff());
    }

    @Bean
    public ProbeScheduler probeScheduler(ExecutorBackend backend, ApplicationEventPublisher eventPublisher,
                                         ResultSink resultSink, MeterRegistry meterRegistry, Clock clock, Ticker ticker,
                                         Sleeper sleeper, SentinelProperties properties) {
        SentinelProperties.Scheduler scheduler = properties.getScheduler();
        return new ProbeScheduler(backend, eventPublisher, resultSink, meterRegistry, clock, ticker, sleeper,
                scheduler.getTick(), scheduler.getMaxInFlight(), scheduler.getShutdownGrace());
    }

    @Bean
    public RetryingResultSink resultSink(MonitoringStore store, MeterRegistry meterRegistry,
                                         SentinelProperties properties) {
        return new RetryingResultSink(store, meterRegistry,
                properties.getSink().getMaxAttempts(), properties.getSink().getBackoff());
    }

    @Bean
    public RetentionAggregator retentionAggregator(MonitoringStore store, Clock clock,
                                                   MeterRegistry meterRegistry, SentinelProperties properties) {
        SentinelProperties.Retention retention = properties.getRetention();
        return new RetentionAggregator(store, clock, meterRegistry, retention.getKeepRaw(), retention.getZone());
    }

    @Bean
    public TargetLoader targetLoader(SentinelProperties properties, MonitoringStore store,
                                     ProbeScheduler probeScheduler) {
        return new TargetLoader(properties, store, probeScheduler);
    }
}
