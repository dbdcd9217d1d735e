package com.tapas.drivertips.dto;

public record ItemResult(
        String itemId,
        Status status,
        String reason) {

    public enum Status {
        SUCCEEDED,
        PARSE_FAILED,
        VALIDATION_FAILED,
        PROCESSING_FAILED
    }

    public static ItemResult succeeded(String itemId) {
        return new ItemResult(itemId, Status.SUCCEEDED, null);
    }

    public static ItemResult failed(String itemId, Status status, String reason) {
        return new ItemResult(itemId, status, reason);
    }

    public boolean isFailed() {
        return status != Status.SUCCEEDED;
    }
}
