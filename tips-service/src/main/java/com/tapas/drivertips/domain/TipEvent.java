package com.tapas.drivertips.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A validated tip, ready to be applied to the driver's day and week aggregates.
 * Never persisted itself.
 */
public record TipEvent(
        String driverId,
        BigDecimal amount,
        Instant eventTime) {
}
