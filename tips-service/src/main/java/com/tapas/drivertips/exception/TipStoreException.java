package com.tapas.drivertips.exception;

/**
 * Base for aggregate store failures. Both subclasses are retryable:
 * the caller redelivers the whole event or answers the request with a 5xx.
 */
public abstract class TipStoreException extends RuntimeException {

    protected TipStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
