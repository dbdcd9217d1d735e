package com.tapas.drivertips.exception;

import java.util.List;

/**
 * Malformed or out-of-range input. Never retried by the service itself.
 */
public class ValidationException extends RuntimeException {

    private final List<String> details;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<String> details) {
        super(message);
        this.details = List.copyOf(details);
    }

    public List<String> getDetails() {
        return details;
    }
}
