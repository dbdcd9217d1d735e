package com.tapas.drivertips.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Running tip total for one driver within one bucket.
 * aggregationKey is the bucket string, e.g. "DAY#2024-01-15" or "WEEK#2024-W03".
 */
public record TipAggregate(
        String driverId,
        String aggregationKey,
        BigDecimal totalAmount,
        Instant createdAt,
        Instant updatedAt) {
}
