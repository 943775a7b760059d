package com.company.sentinel.transport;

import com.company.sentinel.domain.PhaseTimings;
import com.company.sentinel.util.Ticker;
import com.company.sentinel.util.TimeUtils;

/**
 * Collects phase boundaries of a single exchange. Each phase is measured from
 * the end of the previous mark, so phases never overlap. Not thread-safe.
 */
public class PhaseRecorder {

    private final Ticker ticker;
    private final long startedAt;
    private long lastMark;

    private Double dnsLookupMs;
    private Double connectionMs;
    private Double tlsHandshakeMs;
    private Double serverProcessingMs;
    private Double contentTransferMs;

    public PhaseRecorder(Ticker ticker) {
        this.ticker = ticker;
        this.startedAt = ticker.nanoTime();
        this.lastMark = startedAt;
    }

    public void dnsResolved() {
        dnsLookupMs = elapsedSinceMark();
    }

    public void connected() {
        connectionMs = elapsedSinceMark();
    }

    public void tlsEstablished() {
        tlsHandshakeMs = elapsedSinceMark();
    }

    /**
     * Restart the clock before the request is written, so time spent
     * between the connection checks and the exchange is not attributed
     * to the server
     */
    public void requestSent() {
        lastMark = ticker.nanoTime();
    }

    public void headersReceived() {
        serverProcessingMs = elapsedSinceMark();
    }

    public void headersReceivedAt(long nanoTime) {
        serverProcessingMs = TimeUtils.nanosToMillis(Math.max(0, nanoTime - lastMark));
        lastMark = Math.max(lastMark, nanoTime);
    }

    public void bodyReceived() {
        contentTransferMs = elapsedSinceMark();
    }

    public double totalMs() {
        return TimeUtils.nanosToMillis(ticker.nanoTime() - startedAt);
    }

    public long remainingNanos(long budgetNanos) {
        return budgetNanos - (ticker.nanoTime() - startedAt);
    }

    public PhaseTimings toTimings() {
        return PhaseTimings.builder()
                .dnsLookupMs(dnsLookupMs)
                .connectionMs(connectionMs)
                .tlsHandshakeMs(tlsHandshakeMs)
                .serverProcessingMs(serverProcessingMs)
                .contentTransferMs(contentTransferMs)
                .build();
    }

    private double elapsedSinceMark() {
        long now = ticker.nanoTime();
        double elapsed = TimeUtils.nanosToMillis(Math.max(0, now - lastMark));
        lastMark = now;
        return elapsed;
    }
}
