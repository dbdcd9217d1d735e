package com.tapas.drivertips.service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

public final class Futures {

    private Futures() {
    }

    /**
     * Waits for every future to settle, then rethrows the first failure unwrapped so
     * callers see the store's own exception type.
     */
    public static void awaitAll(CompletableFuture<?>... futures) {
        try {
            CompletableFuture.allOf(futures).join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
    }

    /**
     * Strips the {@link CompletionException} wrapper added by {@link CompletableFuture}.
     */
    public static Throwable cause(Throwable e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = cause(e);
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException(cause);
    }
}
