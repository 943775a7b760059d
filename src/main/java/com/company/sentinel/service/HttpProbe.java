package com.company.sentinel.service;

import com.company.sentinel.domain.CheckResult;
import com.company.sentinel.domain.PhaseTimings;
import com.company.sentinel.domain.TargetConfig;
import com.company.sentinel.domain.enums.FailureReason;
import com.company.sentinel.transport.HttpProbeResponse;
import com.company.sentinel.transport.HttpTransport;
import com.company.sentinel.transport.PhaseRecorder;
import com.company.sentinel.util.Sleeper;
import com.company.sentinel.util.Ticker;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HTTP availability check with phase timings, content validation and
 * bounded retries of transient failures
 */
@Slf4j
public class HttpProbe implements Probe {

    private static final int MAX_MATCHED_TEXT = 100;

    private final HttpTransport transport;
    private final Clock clock;
    private final Ticker ticker;
    private final Sleeper sleeper;
    private final Tracer tracer;
    private final Duration timeout;
    private final int retryLimit;
    private final Duration retryBackoff;

    public HttpProbe(HttpTransport transport, Clock clock, Ticker ticker, Sleeper sleeper, Tracer tracer,
                     Duration timeout, int retryLimit, Duration retryBackoff) {
        if (retryLimit < 1) {
            throw new IllegalArgumentException("retryLimit must be at least 1, got " + retryLimit);
        }
        this.transport = transport;
        this.clock = clock;
        this.ticker = ticker;
        this.sleeper = sleeper;
        this.tracer = tracer;
        this.timeout = timeout;
        this.retryLimit = retryLimit;
        this.retryBackoff = retryBackoff;
    }

    @Override
    public CheckResult check(TargetConfig target) {
        Instant checkedAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
        Span span = tracer.spanBuilder("sentinel.probe")
                .setSpanKind(SpanKind.CLIENT)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("target.id", target.getId());
            span.setAttribute("target.url", target.getUrl());

            CheckResult result = runAttempts(target, checkedAt);

            span.setAttribute("probe.success", result.isSuccess());
            span.setAttribute("probe.attempts", result.getAttempts());
            if (!result.isSuccess()) {
                span.setStatus(StatusCode.ERROR, result.getFailureReason().getCode());
            }
            return result;
        } finally {
            span.end();
        }
    }

    private CheckResult runAttempts(TargetConfig target, Instant checkedAt) {
        AttemptBudget budget = new AttemptBudget(retryLimit);
        List<String> attemptErrors = new ArrayList<>();
        Attempt attempt;

        while (true) {
            budget.begin();
            attempt = attemptOnce(target);

            if (attempt.reason != null && attempt.reason.isTransient()) {
                attemptErrors.add(attempt.reason.getCode() + ": " + attempt.message);
            }
            if (!budget.allowsRetry(attempt.reason)) {
                break;
            }

            log.debug("Attempt {}/{} for {} failed with {}, retrying",
                    budget.getAttempts(), retryLimit, target.getUrl(), attempt.reason.getCode());
            try {
                sleeper.sleep(retryBackoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        attempt.details.put("attempts", budget.getAttempts());
        attempt.details.put("retries", budget.getAttempts() - 1);
        if (!attemptErrors.isEmpty()) {
            attempt.details.put("attempt_errors", attemptErrors);
        }

        CheckResult result = attempt.builder
                .targetId(target.getId())
                .checkedAt(checkedAt)
                .success(attempt.reason == null)
                .failureReason(attempt.reason)
                .failureMessage(attempt.message)
                .details(Collections.unmodifiableMap(attempt.details))
                .build();

        if (result.isSuccess()) {
            log.debug("Check of {} succeeded: status {} in {}ms",
                    target.getUrl(), result.getHttpStatus(), result.getResponseTimeMs());
        } else {
            log.info("Check of {} failed after {} attempt(s): {} ({})",
                    target.getUrl(), budget.getAttempts(), result.getFailureReason().getCode(),
                    result.getFailureMessage());
        }
        return result;
    }

    private Attempt attemptOnce(TargetConfig target) {
        Attempt attempt = new Attempt();
        PhaseRecorder recorder = new PhaseRecorder(ticker);

        try {
            HttpProbeResponse response = transport.execute(target, timeout, recorder);

            attempt.builder
                    .responseTimeMs(recorder.totalMs())
                    .timings(recorder.toTimings())
                    .httpStatus(response.getStatusCode())
                    .contentSizeBytes(response.getContentSizeBytes());
            attempt.details.put("content_size_bytes", response.getContentSizeBytes());
            attempt.details.put("headers", response.getHeaders());

            if (response.getStatusCode() >= 400) {
                attempt.fail(FailureReason.HTTP_ERROR, "HTTP status " + response.getStatusCode());
            } else if (target.hasPattern()) {
                validateContent(target, response, attempt);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failTransport(attempt, recorder, FailureReason.UNKNOWN, e);
        } catch (HttpTimeoutException | InterruptedIOException e) {
            // SocketTimeoutException is an InterruptedIOException
            failTransport(attempt, recorder, FailureReason.TIMEOUT, e);
        } catch (IOException e) {
            failTransport(attempt, recorder, FailureReason.CONNECTION_ERROR, e);
        } catch (Exception e) {
            log.error("Unexpected error checking {}", target.getUrl(), e);
            failTransport(attempt, recorder, FailureReason.UNKNOWN, e);
        }
        return attempt;
    }

    private void validateContent(TargetConfig target, HttpProbeResponse response, Attempt attempt) {
        Pattern pattern = Pattern.compile(target.getRegexPattern(), Pattern.DOTALL);
        String body = response.getBody() != null ? response.getBody() : "";
        Matcher matcher = pattern.matcher(body);

        if (matcher.find()) {
            attempt.builder.regexMatched(true);

            String matched = matcher.group();
            Map<String, Object> match = new LinkedHashMap<>();
            match.put("match_position", List.of(matcher.start(), matcher.end()));
            match.put("matched_text", matched.length() > MAX_MATCHED_TEXT
                    ? matched.substring(0, MAX_MATCHED_TEXT) + "..."
                    : matched);
            attempt.details.put("regex_match", match);
        } else {
            attempt.builder.regexMatched(false);
            attempt.fail(FailureReason.PATTERN_MISMATCH,
                    "Regex pattern '" + target.getRegexPattern() + "' not found");
        }
    }

    private void failTransport(Attempt attempt, PhaseRecorder recorder, FailureReason reason, Exception e) {
        PhaseTimings partial = recorder.toTimings();
        attempt.builder.timings(partial);
        attempt.details.put("elapsed_ms", recorder.totalMs());
        attempt.details.put("exception_type", e.getClass().getSimpleName());
        attempt.fail(reason, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }

    /**
     * Mutable state of one attempt, folded into the immutable result at the end
     */
    private static class Attempt {
        private final CheckResult.CheckResultBuilder builder = CheckResult.builder();
        private final Map<String, Object> details = new LinkedHashMap<>();
        private FailureReason reason;
        private String message;

        void fail(FailureReason reason, String message) {
            this.reason = reason;
            this.message = message;
        }
    }

    /**
     * Bounded retry state: total attempts never exceed the limit, and only
     * transient failures earn another attempt
     */
    static class AttemptBudget {
        private final int maxAttempts;
        private int attempts;

        AttemptBudget(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        void begin() {
            if (attempts >= maxAttempts) {
                throw new IllegalStateException("Attempt budget of " + maxAttempts + " exhausted");
            }
            attempts++;
        }

        boolean allowsRetry(FailureReason reason) {
            return reason != null && reason.isTransient() && attempts < maxAttempts;
        }

        int getAttempts() {
            return attempts;
        }
    }
}
