package com.company.sentinel.executor;

import com.company.sentinel.domain.CheckResult;
import com.company.sentinel.domain.TargetConfig;
import com.company.sentinel.exception.CapacityExceededException;
import com.company.sentinel.exception.WorkerLostException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RedisExecutorBackendTest {

    private static final String QUEUE = "sentinel:probe:queue";

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ListOperations<String, String> listOperations;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private RedisExecutorBackend backend;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        // Reply list stays empty, replies are fed through handleReply
        when(listOperations.rightPop(anyString(), any(Duration.class))).thenAnswer(invocation -> {
            Thread.sleep(5);
            return null;
        });

        backend = new RedisExecutorBackend(redisTemplate, objectMapper, meterRegistry,
                QUEUE, "sentinel:probe:replies:", Duration.ofMillis(50), Duration.ofMinutes(10),
                Duration.ofMinutes(5), 2, 1);
    }

    @AfterEach
    void tearDown() {
        backend.shutdown(Duration.ZERO);
    }

    private static ProbeTask task(long id) {
        return ProbeTask.builder()
                .target(TargetConfig.builder().id(id).url("https://t" + id + ".example.com").intervalSeconds(10).build())
                .dispatchedAt(Instant.parse("2024-03-01T10:00:00Z"))
                .build();
    }

    private ProbeTaskEnvelope lastEnvelope() throws Exception {
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(listOperations, atLeastOnce()).leftPush(eq(QUEUE), json.capture());
        return objectMapper.readValue(json.getValue(), ProbeTaskEnvelope.class);
    }

    private String reply(ProbeReply reply) throws Exception {
        return objectMapper.writeValueAsString(reply);
    }

    @Test
    void submitBeforeStartIsRejected() {
        assertThatThrownBy(() -> backend.submit(task(1)))
                .isInstanceOf(CapacityExceededException.class);
    }

    @Test
    void submittedTaskIsQueuedAsEnvelopeWithReplyAddress() throws Exception {
        backend.start();

        Future<CheckResult> future = backend.submit(task(7));

        ProbeTaskEnvelope envelope = lastEnvelope();
        assertThat(envelope.getTask().getTargetId()).isEqualTo(7);
        assertThat(envelope.getTask().getTarget().getUrl()).isEqualTo("https://t7.example.com");
        assertThat(envelope.getReplyTo()).startsWith("sentinel:probe:replies:");
        assertThat(envelope.getExpiresAt()).isEqualTo(Instant.parse("2024-03-01T10:05:00Z"));
        assertThat(future.isDone()).isFalse();
        assertThat(backend.pendingTasks()).isEqualTo(1);
    }

    @Test
    void replyCompletesTheMatchingFuture() throws Exception {
        backend.start();
        Future<CheckResult> future = backend.submit(task(7));
        ProbeTaskEnvelope envelope = lastEnvelope();

        CheckResult result = CheckResult.builder()
                .targetId(7)
                .checkedAt(Instant.parse("2024-03-01T10:00:01Z"))
                .success(true)
                .httpStatus(200)
                .responseTimeMs(42.0)
                .details(Map.of("attempts", 1))
                .build();
        backend.handleReply(reply(ProbeReply.builder()
                .taskId(envelope.getTaskId()).workerId("w1").result(result).build()));

        CheckResult received = future.get(1, TimeUnit.SECONDS);
        assertThat(received.getTargetId()).isEqualTo(7);
        assertThat(received.getHttpStatus()).isEqualTo(200);
        assertThat(received.getCheckedAt()).isEqualTo(result.getCheckedAt());
        assertThat(received.getAttempts()).isEqualTo(1);
        assertThat(backend.pendingTasks()).isZero();
    }

    @Test
    void workerErrorFailsTheFuture() throws Exception {
        backend.start();
        Future<CheckResult> future = backend.submit(task(7));

        backend.handleReply(reply(ProbeReply.builder()
                .taskId(lastEnvelope().getTaskId()).workerId("w1").error("IllegalStateException: boom").build()));

        assertThatThrownBy(() -> future.get(1, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(WorkerLostException.class);
    }

    @Test
    void replyForCancelledTaskIsDropped() throws Exception {
        backend.start();
        Future<CheckResult> future = backend.submit(task(7));
        String taskId = lastEnvelope().getTaskId();
        future.cancel(true);

        backend.handleReply(reply(ProbeReply.builder()
                .taskId(taskId).workerId("w1")
                .result(CheckResult.builder().targetId(7).checkedAt(Instant.EPOCH).success(true).build())
                .build()));

        assertThat(meterRegistry.counter("sentinel.executor.distributed.replies", "outcome", "orphaned").count())
                .isEqualTo(1.0);
        assertThat(backend.pendingTasks()).isZero();
    }

    @Test
    void cancelledTaskIsWithdrawnFromTheQueue() throws Exception {
        backend.start();
        when(listOperations.remove(eq(QUEUE), eq(1L), anyString())).thenReturn(1L);
        Future<CheckResult> future = backend.submit(task(7));
        ArgumentCaptor<String> pushed = ArgumentCaptor.forClass(String.class);
        verify(listOperations).leftPush(eq(QUEUE), pushed.capture());

        future.cancel(true);

        verify(listOperations).remove(QUEUE, 1L, pushed.getValue());
        assertThat(meterRegistry.counter("sentinel.executor.distributed.withdrawn").count()).isEqualTo(1.0);
    }

    @Test
    void completedTaskIsNotWithdrawn() throws Exception {
        backend.start();
        backend.submit(task(7));

        backend.handleReply(reply(ProbeReply.builder()
                .taskId(lastEnvelope().getTaskId()).workerId("w1")
                .result(CheckResult.builder().targetId(7).checkedAt(Instant.EPOCH).success(true).build())
                .build()));

        verify(listOperations, never()).remove(anyString(), anyLong(), any());
    }

    @Test
    void unreadableReplyIsCountedAndIgnored() {
        backend.handleReply("{not json");

        assertThat(meterRegistry.counter("sentinel.executor.distributed.replies", "outcome", "unreadable").count())
                .isEqualTo(1.0);
    }

    @Test
    void outstandingTasksAreBoundedByConcurrencyPlusQueueDepth() {
        backend.start();
        backend.submit(task(1));
        backend.submit(task(2));
        backend.submit(task(3));

        assertThatThrownBy(() -> backend.submit(task(4)))
                .isInstanceOf(CapacityExceededException.class)
                .hasMessageContaining("outstanding");
    }

    @Test
    void unreachableQueueRejectsWithoutTrackingTheTask() {
        backend.start();
        when(listOperations.leftPush(eq(QUEUE), anyString()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> backend.submit(task(1)))
                .isInstanceOf(CapacityExceededException.class);
        assertThat(backend.pendingTasks()).isZero();
        assertThat(meterRegistry.counter("sentinel.executor.distributed.push_failures").count()).isEqualTo(1.0);
    }

    @Test
    void shutdownFailsTasksStillWaitingForReplies() {
        backend.start();
        Future<CheckResult> future = backend.submit(task(1));

        backend.shutdown(Duration.ofMillis(20));

        assertThatThrownBy(() -> future.get(1, TimeUnit.SECONDS))
                .hasCauseInstanceOf(WorkerLostException.class);
        verify(redisTemplate).expire(anyString(), eq(Duration.ofMinutes(10)));
    }
}
