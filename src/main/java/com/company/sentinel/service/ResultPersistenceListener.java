package com.company.sentinel.service;

import com.company.sentinel.event.CheckCompletedEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Moves completed results off the scheduler thread into the sink
 */
@Component
@RequiredArgsConstructor
public class ResultPersistenceListener {

    private final ResultSink resultSink;

    @EventListener
    @Async
    public void onCheckCompleted(CheckCompletedEvent event) {
        resultSink.record(event.getResult());
    }
}
