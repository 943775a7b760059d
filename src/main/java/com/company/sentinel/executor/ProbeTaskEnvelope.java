package com.company.sentinel.executor;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Wire form of a task on the distributed queue. Workers skip an envelope
 * found after {@code expiresAt}, since its dispatcher has given up on it.
 */
@Value
@Builder
@Jacksonized
public class ProbeTaskEnvelope {
    String taskId;
    String replyTo;
    ProbeTask task;
    Instant expiresAt;
}
