package com.company.sentinel.executor;

import com.company.sentinel.domain.CheckResult;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Wire form of a worker's answer. Exactly one of result and error is set.
 */
@Value
@Builder
@Jacksonized
public class ProbeReply {
    String taskId;
    String workerId;
    CheckResult result;
    String error;
}
