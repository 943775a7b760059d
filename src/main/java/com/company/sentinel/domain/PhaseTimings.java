package com.company.sentinel.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;

/**
 * Per-phase wall-clock durations in milliseconds.
 * A phase that did not complete is left null.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PhaseTimings implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final PhaseTimings EMPTY = PhaseTimings.builder().build();

    Double dnsLookupMs;
    Double connectionMs;
    Double tlsHandshakeMs;
    Double serverProcessingMs;
    Double contentTransferMs;

    /**
     * Sum of the phases that completed
     */
    public double completedTotalMs() {
        return valueOf(dnsLookupMs) + valueOf(connectionMs) + valueOf(tlsHandshakeMs)
                + valueOf(serverProcessingMs) + valueOf(contentTransferMs);
    }

    private static double valueOf(Double phase) {
        return phase != null ? phase : 0.0;
    }
}
