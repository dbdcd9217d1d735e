package com.tapas.drivertips.exception;

/**
 * Transient infrastructure failure (connection lost, database down).
 */
public class StoreUnavailableException extends TipStoreException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
