package com.tapas.drivertips.repository;

import com.tapas.drivertips.domain.TipAggregate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Durable tip counters keyed by (driverId, aggregationKey).
 * <p>
 * Implementations must make {@link #increment} atomic per key: any number of
 * concurrent callers may add to the same bucket and the total must equal the
 * exact sum of their amounts. Callers never lock.
 */
public interface TipAggregateStore {

    /**
     * Adds {@code amount} to the bucket, creating it with a zero total if absent.
     * {@code updatedAt} is always set to {@code now}; {@code createdAt} is set to
     * {@code now} only when the row is created.
     *
     * @throws com.tapas.drivertips.exception.StoreUnavailableException on transient failures
     * @throws com.tapas.drivertips.exception.StoreRejectedException when the store sheds load
     */
    void increment(String driverId, String aggregationKey, BigDecimal amount, Instant now);

    Optional<TipAggregate> get(String driverId, String aggregationKey);
}
