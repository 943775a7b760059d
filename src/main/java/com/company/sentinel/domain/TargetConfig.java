package com.company.sentinel.domain;

import com.company.sentinel.domain.enums.ProbeMethod;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Duration;

/**
 * One monitored endpoint, immutable for the lifetime of a target set.
 * The interval has already been checked against the configured bounds.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TargetConfig implements Serializable {
    private static final long serialVersionUID = 1L;

    long id;
    String url;
    int intervalSeconds;
    String regexPattern;      // null when the body is not validated
    @Builder.Default
    ProbeMethod method = ProbeMethod.GET;
    @Builder.Default
    boolean active = true;

    @JsonIgnore
    public Duration getInterval() {
        return Duration.ofSeconds(intervalSeconds);
    }

    public boolean hasPattern() {
        return regexPattern != null && !regexPattern.isEmpty();
    }
}
