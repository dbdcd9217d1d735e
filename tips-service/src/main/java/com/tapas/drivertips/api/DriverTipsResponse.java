package com.tapas.drivertips.api;

import com.tapas.drivertips.dto.DriverTips;

public record DriverTipsResponse(
        TipAggregateResponse daily,
        TipAggregateResponse weekly
) {
    public static DriverTipsResponse from(DriverTips tips) {
        return new DriverTipsResponse(
                TipAggregateResponse.from(tips.daily()),
                TipAggregateResponse.from(tips.weekly())
        );
    }
}
