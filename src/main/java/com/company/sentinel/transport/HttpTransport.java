package com.company.sentinel.transport;

import com.company.sentinel.domain.TargetConfig;

import java.io.IOException;
import java.time.Duration;

public interface HttpTransport {

    /**
     * Execute one request against the target within the timeout budget.
     * Phases are reported to the recorder as they complete, so partial
     * timings survive a failed exchange.
     */
    HttpProbeResponse execute(TargetConfig target, Duration timeout, PhaseRecorder recorder)
            throws IOException, InterruptedException;
}
