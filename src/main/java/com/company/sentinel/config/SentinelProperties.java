package com.company.sentinel.config;

import com.company.sentinel.domain.enums.ProbeMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * All settings under the "sentinel" prefix
 */
@Data
@Validated
@ConfigurationProperties(prefix = "sentinel")
public class SentinelProperties {

    @Valid
    private List<TargetDefinition> targets = new ArrayList<>();

    @Valid
    private Interval interval = new Interval();

    @Valid
    private Probe probe = new Probe();

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Executor executor = new Executor();

    @Valid
    private Worker worker = new Worker();

    @Valid
    private Sink sink = new Sink();

    @Valid
    private Retention retention = new Retention();

    @Data
    public static class TargetDefinition {
        private String url;
        private Integer checkIntervalSeconds;
        private String regexPattern;
        private ProbeMethod method = ProbeMethod.GET;
        private boolean active = true;
    }

    @Data
    public static class Interval {
        @Min(1)
        private int minSeconds = 5;
        @Min(1)
        private int maxSeconds = 300;
    }

    @Data
    public static class Probe {
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
        // Total attempts, first one included
        @Min(1)
        private int retryLimit = 3;
        @NotNull
        private Duration retryBackoff = Duration.ofMillis(500);
        @Min(0)
        private int maxBodyChars = 1_048_576;
        @NotBlank
        private String userAgent = "site-sentinel/1.0";
    }

    @Data
    public static class Scheduler {
        @NotNull
        private Duration tick = Duration.ofMillis(250);
        @NotNull
        private Duration maxInFlight = Duration.ofMinutes(5);
        @NotNull
        private Duration shutdownGrace = Duration.ofSeconds(30);
    }

    @Data
    public static class Executor {
        @Pattern(regexp = "local|distributed")
        private String backend = "local";
        @Min(1)
        private int maxConcurrency = 10;
        @Min(1)
        private int queueDepth = 100;
        @Valid
        private Redis redis = new Redis();
    }

    @Data
    public static class Redis {
        @NotBlank
        private String queueKey = "sentinel:probe:queue";
        @NotBlank
        private String replyKeyPrefix = "sentinel:probe:replies:";
        @NotNull
        private Duration pollTimeout = Duration.ofSeconds(1);
        @NotNull
        private Duration replyTtl = Duration.ofHours(1);
    }

    @Data
    public static class Worker {
        private boolean enabled = false;
        @Min(1)
        private int threads = 4;
    }

    @Data
    public static class Sink {
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration backoff = Duration.ofMillis(200);
    }

    @Data
    public static class Retention {
        private boolean enabled = true;
        @NotBlank
        private String cron = "0 15 0 * * *";
        @NotNull
        private Duration keepRaw = Duration.ofDays(7);
        @NotNull
        private ZoneId zone = ZoneId.of("UTC");
    }
}
