package com.tapas.drivertips.service;

import com.tapas.drivertips.domain.TipAggregate;
import com.tapas.drivertips.dto.DriverTips;
import com.tapas.drivertips.repository.TipAggregateStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Reads the current day and week totals of a driver.
 */
@Service
public class TipQueryService {

    private final DriverService driverService;
    private final TipAggregateStore store;
    private final Executor executor;
    private final Clock clock;

    public TipQueryService(DriverService driverService,
                           TipAggregateStore store,
                           @Qualifier("tipsExecutor") Executor executor,
                           Clock clock) {
        this.driverService = driverService;
        this.store = store;
        this.executor = executor;
        this.clock = clock;
    }

    public DriverTips getDriverTips(String driverId) {
        return getDriverTips(driverId, clock.instant());
    }

    /**
     * @throws com.tapas.drivertips.exception.DriverNotFoundException if the driver does not exist
     */
    public DriverTips getDriverTips(String driverId, Instant now) {
        driverService.getDriverById(driverId);

        String dayKey = TimeBuckets.dayKey(now);
        String weekKey = TimeBuckets.weekKey(now);

        CompletableFuture<Optional<TipAggregate>> daily =
                CompletableFuture.supplyAsync(() -> store.get(driverId, dayKey), executor);
        CompletableFuture<Optional<TipAggregate>> weekly =
                CompletableFuture.supplyAsync(() -> store.get(driverId, weekKey), executor);
        Futures.awaitAll(daily, weekly);

        return new DriverTips(
                daily.join().orElse(null),
                weekly.join().orElse(null));
    }
}
