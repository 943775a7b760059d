package com.company.sentinel.config;

import com.company.sentinel.executor.RedisProbeWorker;
import com.company.sentinel.service.Probe;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Redis connection for the distributed executor backend and its workers.
 * Connections are opened on first use, so a local-only process never dials out.
 */
@Configuration
public class RedisConfig {

    @Bean
    public LettuceConnectionFactory redisConnectionFactory(SentinelProperties properties) {
        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(Duration.ofSeconds(5))
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .build();

        // Blocking pops wait up to the poll timeout, commands must outlast them
        Duration pollTimeout = properties.getExecutor().getRedis().getPollTimeout();
        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .clientOptions(clientOptions)
                .commandTimeout(pollTimeout.plusSeconds(2))
                .build();

        RedisStandaloneConfiguration serverConfig = new RedisStandaloneConfiguration();
        serverConfig.setHostName(System.getenv().getOrDefault("REDIS_HOST", "localhost"));
        serverConfig.setPort(Integer.parseInt(System.getenv().getOrDefault("REDIS_PORT", "6379")));

        String password = System.getenv("REDIS_PASSWORD");
        if (password != null && !password.isEmpty()) {
            serverConfig.setPassword(password);
        }

        return new LettuceConnectionFactory(serverConfig, clientConfig);
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    @Bean
    @ConditionalOnProperty(value = "sentinel.worker.enabled", havingValue = "true")
    public RedisProbeWorker redisProbeWorker(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                             MeterRegistry meterRegistry, Probe probe, Clock clock,
                                             SentinelProperties properties) {
        SentinelProperties.Redis redis = properties.getExecutor().getRedis();
        return new RedisProbeWorker(redisTemplate, objectMapper, meterRegistry, probe, clock,
                redis.getQueueKey(), redis.getPollTimeout(), redis.getReplyTtl(),
                properties.getWorker().getThreads());
    }
}
