package com.tapas.drivertips.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * Tip event as read from the tip-events topic. amount may arrive as a JSON number
 * or a numeric string; Jackson coerces both. The digit limits match the
 * NUMERIC(19, 4) total_amount column.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TipEventPayload(
        @NotBlank(message = "driverId is required") String driverId,
        @NotNull(message = "amount is required")
        @Positive(message = "amount must be a positive number")
        @Digits(integer = 15, fraction = 4,
                message = "amount must have at most 15 integer and 4 fraction digits") BigDecimal amount,
        @NotBlank(message = "eventTime is required") String eventTime) {
}
