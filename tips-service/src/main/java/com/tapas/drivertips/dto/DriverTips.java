package com.tapas.drivertips.dto;

import com.tapas.drivertips.domain.TipAggregate;

/**
 * Current day and week aggregates of a driver; either is null when no tip has
 * landed in that bucket yet.
 */
public record DriverTips(
        TipAggregate daily,
        TipAggregate weekly) {
}
