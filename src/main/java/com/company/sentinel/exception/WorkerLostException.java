package com.company.sentinel.exception;

public class WorkerLostException extends RuntimeException {
    public WorkerLostException(String message) {
        super(message);
    }
}
