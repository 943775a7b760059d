package com.company.sentinel.service;

import com.company.sentinel.domain.CheckResult;
import com.company.sentinel.domain.TargetConfig;

/**
 * Executes one check against one target. Performs network I/O only.
 */
@FunctionalInterface
public interface Probe {

    CheckResult check(TargetConfig target);
}
