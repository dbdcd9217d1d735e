package com.tapas.drivertips.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of one batch, one result per input item in input order.
 * Serializes as {@code {"batchItemFailures": [{"itemIdentifier": ...}]}}.
 */
public record BatchReport(@JsonIgnore List<ItemResult> results) {

    public BatchReport {
        results = List.copyOf(results);
    }

    @JsonIgnore
    public Set<String> failedIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (ItemResult result : results) {
            if (result.isFailed()) {
                ids.add(result.itemId());
            }
        }
        return ids;
    }

    @JsonProperty("batchItemFailures")
    public List<BatchItemFailure> batchItemFailures() {
        return failedIds().stream()
                .map(BatchItemFailure::new)
                .toList();
    }

    @JsonIgnore
    public boolean isFullSuccess() {
        return failedIds().isEmpty();
    }
}
