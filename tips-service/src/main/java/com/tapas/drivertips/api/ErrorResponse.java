package com.tapas.drivertips.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        String message,
        List<String> errors
) {
    public static ErrorResponse of(String message) {
        return new ErrorResponse(message, List.of());
    }
}
