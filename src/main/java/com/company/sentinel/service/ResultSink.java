package com.company.sentinel.service;

import com.company.sentinel.domain.CheckResult;

/**
 * Durable destination of probe results. Writing the same
 * (targetId, checkedAt) twice leaves one stored row.
 */
public interface ResultSink {

    /**
     * @return true if the result was newly stored, false if it was a
     * duplicate or had to be dropped
     */
    boolean record(CheckResult result);

    /**
     * Account for a result lost on its way to {@link #record}
     */
    void markDropped(CheckResult result, String reason);
}
