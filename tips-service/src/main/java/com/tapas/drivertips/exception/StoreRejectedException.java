package com.tapas.drivertips.exception;

/**
 * The store refused the operation for capacity reasons (lock contention, timeouts).
 * Back off and retry; not a permanent failure.
 */
public class StoreRejectedException extends TipStoreException {

    public StoreRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
