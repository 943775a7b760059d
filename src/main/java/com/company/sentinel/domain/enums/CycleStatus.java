package com.company.sentinel.domain.enums;

public enum CycleStatus {
    COMPLETED("Summarize and purge both ran"),
    SKIPPED_LOCKED("Another cycle held the run-lock");

    private final String description;

    CycleStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
