package com.company.sentinel.transport;

import com.company.sentinel.domain.PhaseTimings;
import com.company.sentinel.scheduler.FakeTicker;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class PhaseRecorderTest {

    @Test
    void phasesAreMeasuredBetweenConsecutiveMarks() {
        FakeTicker ticker = new FakeTicker();
        PhaseRecorder recorder = new PhaseRecorder(ticker);

        ticker.advance(Duration.ofMillis(3));
        recorder.dnsResolved();
        ticker.advance(Duration.ofMillis(7));
        recorder.connected();
        // Gap between the connection checks and the request is not charged to any phase
        ticker.advance(Duration.ofMillis(5));
        recorder.requestSent();
        ticker.advance(Duration.ofMillis(40));
        recorder.headersReceived();
        ticker.advance(Duration.ofMillis(2));
        recorder.bodyReceived();

        PhaseTimings timings = recorder.toTimings();
        assertThat(timings.getDnsLookupMs()).isEqualTo(3.0);
        assertThat(timings.getConnectionMs()).isEqualTo(7.0);
        assertThat(timings.getTlsHandshakeMs()).isNull();
        assertThat(timings.getServerProcessingMs()).isEqualTo(40.0);
        assertThat(timings.getContentTransferMs()).isEqualTo(2.0);
        assertThat(recorder.totalMs()).isEqualTo(57.0);
        assertThat(timings.completedTotalMs()).isLessThan(recorder.totalMs());
    }

    @Test
    void headerArrivalTimeSplitsServerAndTransferPhases() {
        FakeTicker ticker = new FakeTicker();
        PhaseRecorder recorder = new PhaseRecorder(ticker);
        recorder.requestSent();

        ticker.advance(Duration.ofMillis(25));
        long headersAt = ticker.nanoTime();
        ticker.advance(Duration.ofMillis(15));
        recorder.headersReceivedAt(headersAt);
        recorder.bodyReceived();

        assertThat(recorder.toTimings().getServerProcessingMs()).isEqualTo(25.0);
        assertThat(recorder.toTimings().getContentTransferMs()).isEqualTo(15.0);
    }

    @Test
    void remainingBudgetShrinksWithElapsedTime() {
        FakeTicker ticker = new FakeTicker();
        PhaseRecorder recorder = new PhaseRecorder(ticker);

        ticker.advance(Duration.ofMillis(400));

        assertThat(recorder.remainingNanos(Duration.ofSeconds(1).toNanos()))
                .isEqualTo(Duration.ofMillis(600).toNanos());
    }
}
