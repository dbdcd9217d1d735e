package com.tapas.drivertips.repository;

import com.tapas.drivertips.domain.TipAggregate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Non-durable store for local runs and tests. {@link ConcurrentMap#compute} runs the
 * update for a key atomically, which gives the same per-key guarantee as the
 * database upsert.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "tips.store.type", havingValue = "memory")
public class InMemoryTipAggregateStore implements TipAggregateStore {

    private final ConcurrentMap<Key, TipAggregate> aggregates = new ConcurrentHashMap<>();

    public InMemoryTipAggregateStore() {
        log.info("Using in-memory tip aggregate store; totals are lost on restart");
    }

    @Override
    public void increment(String driverId, String aggregationKey, BigDecimal amount, Instant now) {
        aggregates.compute(new Key(driverId, aggregationKey), (key, existing) -> existing == null
                ? new TipAggregate(driverId, aggregationKey, amount, now, now)
                : new TipAggregate(driverId, aggregationKey,
                        existing.totalAmount().add(amount),
                        existing.createdAt(),
                        now));
    }

    @Override
    public Optional<TipAggregate> get(String driverId, String aggregationKey) {
        return Optional.ofNullable(aggregates.get(new Key(driverId, aggregationKey)));
    }

    private record Key(String driverId, String aggregationKey) {
    }
}
