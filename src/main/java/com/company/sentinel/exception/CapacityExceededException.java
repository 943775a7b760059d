package com.company.sentinel.exception;

/**
 * Executor backend cannot take another task right now. Callers defer, never block.
 */
public class CapacityExceededException extends RuntimeException {
    public CapacityExceededException(String message) {
        super(message);
    }

    public CapacityExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
