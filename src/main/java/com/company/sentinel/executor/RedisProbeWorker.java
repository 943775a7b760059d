package com.company.sentinel.executor;

import com.company.sentinel.domain.CheckResult;
import com.company.sentinel.service.Probe;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Worker side of the distributed backend. Each thread pops one task at a
 * time from the shared queue, so the cluster-wide concurrency ceiling is the
 * sum of worker threads across processes.
 */
@Slf4j
public class RedisProbeWorker implements SmartLifecycle {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Probe probe;
    private final Clock clock;
    private final String queueKey;
    private final Duration pollTimeout;
    private final Duration replyTtl;
    private final int threads;
    private final String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

    private ExecutorService pool;
    private volatile boolean running;

    public RedisProbeWorker(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                            MeterRegistry meterRegistry, Probe probe, Clock clock, String queueKey,
                            Duration pollTimeout, Duration replyTtl, int threads) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.probe = probe;
        this.clock = clock;
        this.queueKey = queueKey;
        this.pollTimeout = pollTimeout;
        this.replyTtl = replyTtl;
        this.threads = threads;
    }

    @Override
    public void start() {
        running = true;
        pool = Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("probe-remote-worker-"));
        for (int i = 0; i < threads; i++) {
            pool.execute(this::workLoop);
        }
        log.info("Probe worker {} consuming {} with {} thread(s)", workerId, queueKey, threads);
    }

    @Override
    public void stop() {
        running = false;
        if (pool == null) {
            return;
        }
        pool.shutdown();
        try {
            // A thread mid-probe finishes and replies, idle threads return after one poll
            if (!pool.awaitTermination(pollTimeout.toMillis() * 2 + 1000, TimeUnit.MILLISECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Probe worker {} stopped", workerId);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void workLoop() {
        while (running) {
            try {
                processNext();
            } catch (Exception e) {
                log.error("Probe worker {} failed to process a task", workerId, e);
                meterRegistry.counter("sentinel.worker.failures").increment();
                try {
                    Thread.sleep(pollTimeout.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    /**
     * Pop and run at most one task
     *
     * @return true if a task was taken from the queue
     */
    boolean processNext() throws JsonProcessingException {
        String json = redisTemplate.opsForList().rightPop(queueKey, pollTimeout);
        if (json == null) {
            return false;
        }

        ProbeTaskEnvelope envelope;
        try {
            envelope = objectMapper.readValue(json, ProbeTaskEnvelope.class);
        } catch (JsonProcessingException e) {
            log.error("Discarding unreadable task from {}", queueKey, e);
            meterRegistry.counter("sentinel.worker.tasks", "outcome", "unreadable").increment();
            return true;
        }

        if (envelope.getExpiresAt() != null && !clock.instant().isBefore(envelope.getExpiresAt())) {
            // The dispatcher has already recorded this task as abandoned
            log.debug("Skipping task {} for target {}, expired at {}", envelope.getTaskId(),
                    envelope.getTask().getTargetId(), envelope.getExpiresAt());
            meterRegistry.counter("sentinel.worker.tasks", "outcome", "expired").increment();
            return true;
        }

        ProbeReply.ProbeReplyBuilder reply = ProbeReply.builder()
                .taskId(envelope.getTaskId())
                .workerId(workerId);
        try {
            CheckResult result = probe.check(envelope.getTask().getTarget());
            reply.result(result);
            meterRegistry.counter("sentinel.worker.tasks", "outcome", "completed").increment();
        } catch (RuntimeException e) {
            log.error("Probe of target {} failed on worker {}", envelope.getTask().getTargetId(), workerId, e);
            reply.error(e.getClass().getSimpleName() + ": " + e.getMessage());
            meterRegistry.counter("sentinel.worker.tasks", "outcome", "errored").increment();
        }

        redisTemplate.opsForList().leftPush(envelope.getReplyTo(), objectMapper.writeValueAsString(reply.build()));
        redisTemplate.expire(envelope.getReplyTo(), replyTtl);
        return true;
    }
}
