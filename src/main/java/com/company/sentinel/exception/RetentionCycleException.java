package com.company.sentinel.exception;

import java.time.LocalDate;

public class RetentionCycleException extends RuntimeException {

    private final LocalDate failedDay;

    public RetentionCycleException(LocalDate failedDay, Throwable cause) {
        super("Failed to summarize results for " + failedDay + ", purge skipped", cause);
        this.failedDay = failedDay;
    }

    public LocalDate getFailedDay() {
        return failedDay;
    }
}
