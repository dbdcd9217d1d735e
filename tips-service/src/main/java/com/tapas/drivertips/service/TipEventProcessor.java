package com.tapas.drivertips.service;

import com.tapas.drivertips.domain.TipEvent;
import com.tapas.drivertips.repository.TipAggregateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Applies one tip to the driver's day and week aggregates.
 * <p>
 * The two increments are independent and may land in either order. If one of them
 * fails the tip is reported as failed and will be redelivered in full, so the bucket
 * that did succeed is counted twice; at-least-once delivery accepts that.
 */
@Service
public class TipEventProcessor {

    private static final Logger log = LoggerFactory.getLogger(TipEventProcessor.class);

    private final TipAggregateStore store;
    private final Executor executor;
    private final Clock clock;

    public TipEventProcessor(TipAggregateStore store,
                             @Qualifier("tipsExecutor") Executor executor,
                             Clock clock) {
        this.store = store;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Applies the tip and waits for both buckets.
     *
     * @throws com.tapas.drivertips.exception.TipStoreException if either increment fails
     */
    public void applyTip(TipEvent event) {
        Futures.awaitAll(applyTipAsync(event));
    }

    /**
     * Starts both increments on the tips executor. The returned future completes once
     * both have settled, exceptionally if either failed.
     */
    public CompletableFuture<Void> applyTipAsync(TipEvent event) {
        Instant now = clock.instant();
        String dayKey = TimeBuckets.dayKey(event.eventTime());
        String weekKey = TimeBuckets.weekKey(event.eventTime());

        return CompletableFuture.allOf(
                        CompletableFuture.runAsync(
                                () -> store.increment(event.driverId(), dayKey, event.amount(), now), executor),
                        CompletableFuture.runAsync(
                                () -> store.increment(event.driverId(), weekKey, event.amount(), now), executor))
                .thenRun(() -> log.debug("Applied tip {} for driver {} to {} and {}",
                        event.amount(), event.driverId(), dayKey, weekKey));
    }
}
