package com.company.sentinel.event;

import com.company.sentinel.domain.CheckResult;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CheckCompletedEvent {
    private final CheckResult result;
}
