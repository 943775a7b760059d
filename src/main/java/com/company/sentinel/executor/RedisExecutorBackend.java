package com.company.sentinel.executor;

import com.company.sentinel.domain.CheckResult;
import com.company.sentinel.exception.CapacityExceededException;
import com.company.sentinel.exception.WorkerLostException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Distributed backend: tasks go onto a shared Redis list, any number of
 * {@link RedisProbeWorker}s pop them atomically and push their reply to this
 * dispatcher's own reply list.
 * <p>
 * Replies for tasks this dispatcher no longer tracks (cancelled, abandoned,
 * or from a previous process) are dropped so a result is never recorded twice.
 */
@Slf4j
public class RedisExecutorBackend implements ExecutorBackend {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final String queueKey;
    private final String replyKey;
    private final Duration pollTimeout;
    private final Duration replyTtl;
    private final Duration taskTtl;
    private final int maxConcurrency;
    private final int maxOutstanding;

    private final Map<String, CompletableFuture<CheckResult>> pending = new ConcurrentHashMap<>();
    private final ExecutorService collector = Executors.newSingleThreadExecutor(
            new CustomizableThreadFactory("probe-reply-collector-"));
    private volatile boolean running;

    public RedisExecutorBackend(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                MeterRegistry meterRegistry, String queueKey, String replyKeyPrefix,
                                Duration pollTimeout, Duration replyTtl, Duration taskTtl,
                                int maxConcurrency, int queueDepth) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.queueKey = queueKey;
        this.replyKey = replyKeyPrefix + UUID.randomUUID();
        this.pollTimeout = pollTimeout;
        this.replyTtl = replyTtl;
        this.taskTtl = taskTtl;
        this.maxConcurrency = maxConcurrency;
        this.maxOutstanding = maxConcurrency + queueDepth;
    }

    public void start() {
        running = true;
        collector.execute(this::collectReplies);
        log.info("Distributed executor backend ready: queue {}, replies on {}, {} outstanding max",
                queueKey, replyKey, maxOutstanding);
    }

    @Override
    public Future<CheckResult> submit(ProbeTask task) {
        if (!running) {
            throw new CapacityExceededException("Distributed backend is not running");
        }
        if (pending.size() >= maxOutstanding) {
            throw new CapacityExceededException("Distributed backend has "
                    + pending.size() + " outstanding tasks (max " + maxOutstanding + ")");
        }

        String taskId = UUID.randomUUID().toString();
        String json;
        try {
            json = objectMapper.writeValueAsString(ProbeTaskEnvelope.builder()
                    .taskId(taskId)
                    .replyTo(replyKey)
                    .task(task)
                    .expiresAt(task.getDispatchedAt().plus(taskTtl))
                    .build());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize probe task for target " + task.getTargetId(), e);
        }

        CompletableFuture<CheckResult> future = new CompletableFuture<>();
        pending.put(taskId, future);
        // Cancelled or abandoned tasks stop being tracked, late replies are dropped
        future.whenComplete((result, error) -> {
            pending.remove(taskId);
            if (error instanceof CancellationException) {
                withdraw(taskId, json);
            }
        });

        try {
            redisTemplate.opsForList().leftPush(queueKey, json);
        } catch (RuntimeException e) {
            pending.remove(taskId);
            meterRegistry.counter("sentinel.executor.distributed.push_failures").increment();
            throw new CapacityExceededException("Task queue unavailable", e);
        }

        return future;
    }

    /**
     * Take a cancelled task's envelope back off the queue if no worker has popped it yet
     */
    private void withdraw(String taskId, String json) {
        try {
            Long removed = redisTemplate.opsForList().remove(queueKey, 1, json);
            if (removed != null && removed > 0) {
                meterRegistry.counter("sentinel.executor.distributed.withdrawn").increment();
            }
        } catch (RuntimeException e) {
            log.warn("Failed to withdraw cancelled task {} from {}, workers will skip it once expired",
                    taskId, queueKey, e);
        }
    }

    @Override
    public int maxConcurrency() {
        return maxConcurrency;
    }

    @Override
    public String name() {
        return "distributed";
    }

    @Override
    public int pendingTasks() {
        return pending.size();
    }

    private void collectReplies() {
        while (running) {
            try {
                pollOnce();
            } catch (Exception e) {
                if (!running) {
                    break;
                }
                log.error("Failed to collect probe replies from {}", replyKey, e);
                meterRegistry.counter("sentinel.executor.distributed.collect_failures").increment();
                pauseAfterFailure();
            }
        }
    }

    /**
     * Wait up to the poll timeout for one reply and complete its future
     *
     * @return true if a reply was consumed
     */
    boolean pollOnce() {
        String json = redisTemplate.opsForList().rightPop(replyKey, pollTimeout);
        if (json == null) {
            return false;
        }
        handleReply(json);
        return true;
    }

    void handleReply(String json) {
        ProbeReply reply;
        try {
            reply = objectMapper.readValue(json, ProbeReply.class);
        } catch (JsonProcessingException e) {
            log.error("Discarding unreadable probe reply on {}", replyKey, e);
            meterRegistry.counter("sentinel.executor.distributed.replies", "outcome", "unreadable").increment();
            return;
        }

        CompletableFuture<CheckResult> future = pending.get(reply.getTaskId());
        if (future == null) {
            log.warn("Dropping reply for unknown or expired task {} from worker {}",
                    reply.getTaskId(), reply.getWorkerId());
            meterRegistry.counter("sentinel.executor.distributed.replies", "outcome", "orphaned").increment();
            return;
        }

        if (reply.getError() != null || reply.getResult() == null) {
            future.completeExceptionally(new WorkerLostException("Worker " + reply.getWorkerId()
                    + " failed task " + reply.getTaskId() + ": " + reply.getError()));
            meterRegistry.counter("sentinel.executor.distributed.replies", "outcome", "error").increment();
        } else {
            future.complete(reply.getResult());
            meterRegistry.counter("sentinel.executor.distributed.replies", "outcome", "result").increment();
        }
    }

    private void pauseAfterFailure() {
        try {
            Thread.sleep(pollTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    @Override
    public void shutdown(Duration grace) {
        long deadline = System.nanoTime() + grace.toNanos();
        while (!pending.isEmpty() && System.nanoTime() < deadline) {
            try {
                Thread.sleep(Math.min(100, Math.max(1, grace.toMillis())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        running = false;
        collector.shutdownNow();
        try {
            collector.awaitTermination(pollTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (!pending.isEmpty()) {
            log.warn("Abandoning {} outstanding distributed task(s) at shutdown", pending.size());
            pending.values().forEach(future ->
                    future.completeExceptionally(new WorkerLostException("Backend shut down before reply")));
        }

        try {
            redisTemplate.expire(replyKey, replyTtl);
        } catch (RuntimeException e) {
            log.warn("Failed to set expiry on reply list {}", replyKey, e);
        }
    }
}
