package com.tapas.drivertips.exception;

public class DriverNotFoundException extends RuntimeException {

    public DriverNotFoundException(String id) {
        super(String.format("Driver with id '%s' not found", id));
    }
}
