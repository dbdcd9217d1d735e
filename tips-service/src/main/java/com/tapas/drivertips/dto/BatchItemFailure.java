package com.tapas.drivertips.dto;

public record BatchItemFailure(String itemIdentifier) {
}
