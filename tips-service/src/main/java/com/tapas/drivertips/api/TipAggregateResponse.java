package com.tapas.drivertips.api;

import com.tapas.drivertips.domain.TipAggregate;

import java.math.BigDecimal;
import java.time.Instant;

public record TipAggregateResponse(
        String driverId,
        String aggregationKey,
        BigDecimal totalAmount,
        Instant updatedAt
) {
    public static TipAggregateResponse from(TipAggregate aggregate) {
        if (aggregate == null) {
            return null;
        }
        return new TipAggregateResponse(
                aggregate.driverId(),
                aggregate.aggregationKey(),
                aggregate.totalAmount(),
                aggregate.updatedAt()
        );
    }
}
