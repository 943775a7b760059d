package com.company.sentinel.domain.enums;

public enum FailureReason {
    TIMEOUT("timeout", true),
    CONNECTION_ERROR("connection_error", true),
    HTTP_ERROR("http_error", false),
    PATTERN_MISMATCH("pattern_mismatch", false),
    UNKNOWN("unknown", false);

    private final String code;
    private final boolean transientFailure;

    FailureReason(String code, boolean transientFailure) {
        this.code = code;
        this.transientFailure = transientFailure;
    }

    /**
     * Value stored in the failure_reason column
     */
    public String getCode() {
        return code;
    }

    /**
     * Transient failures are retried within a single probe
     */
    public boolean isTransient() {
        return transientFailure;
    }

    public static FailureReason fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (FailureReason reason : values()) {
            if (reason.code.equalsIgnoreCase(code)) {
                return reason;
            }
        }
        return UNKNOWN;
    }
}
