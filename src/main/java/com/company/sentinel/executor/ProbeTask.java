package com.company.sentinel.executor;

import com.company.sentinel.domain.TargetConfig;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Instant;

/**
 * Unit of work handed to a backend. Carries a snapshot of the target so
 * remote workers need no access to scheduler state.
 */
@Value
@Builder
@Jacksonized
public class ProbeTask implements Serializable {
    private static final long serialVersionUID = 1L;

    TargetConfig target;
    Instant dispatchedAt;

    @JsonIgnore
    public long getTargetId() {
        return target.getId();
    }
}
