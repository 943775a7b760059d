package com.company.sentinel.exception;

import java.util.List;

public class InvalidTargetException extends RuntimeException {

    private final List<String> errors;

    public InvalidTargetException(List<String> errors) {
        super("Invalid target configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
