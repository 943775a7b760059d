package com.company.sentinel.domain;

import com.company.sentinel.domain.enums.FailureReason;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one probe. Persistence key is (targetId, checkedAt).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CheckResult implements Serializable {
    private static final long serialVersionUID = 1L;

    long targetId;
    Instant checkedAt;

    // Timing information, null when no response was received
    Double responseTimeMs;
    @Builder.Default
    PhaseTimings timings = PhaseTimings.EMPTY;

    Long contentSizeBytes;
    Integer httpStatus;

    boolean success;
    Boolean regexMatched;     // null if no pattern is configured

    FailureReason failureReason;
    String failureMessage;

    @Builder.Default
    Map<String, Object> details = Collections.emptyMap();

    @JsonIgnore
    public int getAttempts() {
        Object attempts = details.get("attempts");
        return attempts instanceof Number ? ((Number) attempts).intValue() : 1;
    }

    @JsonIgnore
    public int getRetries() {
        Object retries = details.get("retries");
        return retries instanceof Number ? ((Number) retries).intValue() : 0;
    }

    /**
     * Result for a probe that never produced its own outcome
     * (lost worker, abandoned or cancelled task)
     */
    public static CheckResult executorFailure(long targetId, Instant checkedAt, String message) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempts", 0);
        details.put("retries", 0);
        details.put("executor_error", message);

        return CheckResult.builder()
                .targetId(targetId)
                .checkedAt(checkedAt)
                .success(false)
                .failureReason(FailureReason.UNKNOWN)
                .failureMessage(message)
                .details(Collections.unmodifiableMap(details))
                .build();
    }
}
