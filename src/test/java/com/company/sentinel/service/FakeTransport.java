package com.company.sentinel.service;

import com.company.sentinel.domain.TargetConfig;
import com.company.sentinel.scheduler.FakeTicker;
import com.company.sentinel.transport.HttpProbeResponse;
import com.company.sentinel.transport.HttpTransport;
import com.company.sentinel.transport.PhaseRecorder;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Scripted transport. Each successful exchange walks through every phase,
 * advancing the ticker by a fixed step per phase.
 */
class FakeTransport implements HttpTransport {

    private final FakeTicker ticker;
    private final Duration phaseStep;
    private final Deque<Object> script = new ArrayDeque<>();
    int calls;

    FakeTransport(FakeTicker ticker, Duration phaseStep) {
        this.ticker = ticker;
        this.phaseStep = phaseStep;
    }

    FakeTransport thenRespond(int status, String body) {
        script.add(HttpProbeResponse.builder()
                .statusCode(status)
                .body(body)
                .contentSizeBytes(body != null ? body.length() : 0)
                .build());
        return this;
    }

    FakeTransport thenThrow(Exception e) {
        script.add(e);
        return this;
    }

    @Override
    public HttpProbeResponse execute(TargetConfig target, Duration timeout, PhaseRecorder recorder)
            throws IOException, InterruptedException {
        calls++;
        Object next = script.size() > 1 ? script.poll() : script.peek();
        if (next == null) {
            throw new IllegalStateException("No scripted outcome");
        }

        ticker.advance(phaseStep);
        recorder.dnsResolved();

        if (next instanceof IOException) {
            ticker.advance(phaseStep);
            throw (IOException) next;
        }
        if (next instanceof RuntimeException) {
            throw (RuntimeException) next;
        }

        ticker.advance(phaseStep);
        recorder.connected();
        ticker.advance(phaseStep);
        recorder.tlsEstablished();
        recorder.requestSent();
        ticker.advance(phaseStep);
        recorder.headersReceived();
        ticker.advance(phaseStep);
        recorder.bodyReceived();
        return (HttpProbeResponse) next;
    }
}
