package com.company.sentinel.config;

import com.company.sentinel.executor.LocalExecutorBackend;
import com.company.sentinel.executor.RedisExecutorBackend;
import com.company.sentinel.service.Probe;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Exactly one executor backend per process, chosen by sentinel.executor.backend.
 * The probe scheduler owns its shutdown.
 */
@Configuration
public class ExecutorBackendConfig {

    @Bean(destroyMethod = "")
    @ConditionalOnProperty(value = "sentinel.executor.backend", havingValue = "local", matchIfMissing = true)
    public LocalExecutorBackend localExecutorBackend(Probe probe, SentinelProperties properties) {
        SentinelProperties.Executor executor = properties.getExecutor();
        return new LocalExecutorBackend(probe, executor.getMaxConcurrency(), executor.getQueueDepth());
    }

    @Bean(initMethod = "start", destroyMethod = "")
    @ConditionalOnProperty(value = "sentinel.executor.backend", havingValue = "distributed")
    public RedisExecutorBackend redisExecutorBackend(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                                     MeterRegistry meterRegistry, SentinelProperties properties) {
        SentinelProperties.Executor executor = properties.getExecutor();
        SentinelProperties.Redis redis = executor.getRedis();
        return new RedisExecutorBackend(redisTemplate, objectMapper, meterRegistry,
                redis.getQueueKey(), redis.getReplyKeyPrefix(), redis.getPollTimeout(), redis.getReplyTtl(),
                properties.getScheduler().getMaxInFlight(),
                executor.getMaxConcurrency(), executor.getQueueDepth());
    }
}
