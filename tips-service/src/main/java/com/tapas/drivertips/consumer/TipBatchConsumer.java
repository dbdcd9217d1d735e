package com.tapas.drivertips.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tapas.drivertips.domain.TipEvent;
import com.tapas.drivertips.dto.BatchReport;
import com.tapas.drivertips.dto.InboundTip;
import com.tapas.drivertips.dto.ItemResult;
import com.tapas.drivertips.dto.TipEventPayload;
import com.tapas.drivertips.exception.ValidationException;
import com.tapas.drivertips.service.Futures;
import com.tapas.drivertips.service.TipEventProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs every item of a delivered batch through parsing, validation and the
 * {@link TipEventProcessor}. The store writes of all items run in parallel and each
 * item fails on its own: a bad item is reported in the {@link BatchReport} and never
 * stops the others.
 */
@Component
public class TipBatchConsumer {

    private static final Logger log =
            LoggerFactory.getLogger(TipBatchConsumer.class);

    private final ObjectMapper objectMapper;
    private final TipEventValidator validator;
    private final TipEventProcessor processor;

    public TipBatchConsumer(ObjectMapper objectMapper,
                            TipEventValidator validator,
                            TipEventProcessor processor) {
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.processor = processor;
    }

    public BatchReport processBatch(List<InboundTip> items) {
        var pending = new ArrayList<CompletableFuture<ItemResult>>(items.size());
        for (InboundTip item : items) {
            pending.add(process(item));
        }

        var results = pending.stream()
                .map(CompletableFuture::join)
                .toList();
        var report = new BatchReport(results);

        log.info("Processed batch of {} tip events, {} failed", items.size(), report.failedIds().size());
        return report;
    }

    // never completes exceptionally
    private CompletableFuture<ItemResult> process(InboundTip item) {
        TipEventPayload payload;
        try {
            payload = objectMapper.readValue(item.rawPayload(), TipEventPayload.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse JSON for message {}: {}", item.id(), e.getMessage());
            return CompletableFuture.completedFuture(
                    ItemResult.failed(item.id(), ItemResult.Status.PARSE_FAILED, e.getMessage()));
        }

        TipEvent event;
        try {
            event = validator.validate(payload);
        } catch (ValidationException e) {
            log.error("Validation failed for message {}: {}", item.id(), e.getDetails());
            return CompletableFuture.completedFuture(
                    ItemResult.failed(item.id(), ItemResult.Status.VALIDATION_FAILED, String.join("; ", e.getDetails())));
        }

        try {
            return processor.applyTipAsync(event)
                    .handle((ignored, e) -> e == null
                            ? applied(item, event)
                            : processingFailed(item, Futures.cause(e)));
        } catch (RuntimeException e) {
            // executor saturated
            return CompletableFuture.completedFuture(processingFailed(item, e));
        }
    }

    private ItemResult applied(InboundTip item, TipEvent event) {
        log.info("Processed tip event for driver {}, amount: {}", event.driverId(), event.amount());
        return ItemResult.succeeded(item.id());
    }

    private ItemResult processingFailed(InboundTip item, Throwable e) {
        log.error("Failed to process tip event for message {}", item.id(), e);
        return ItemResult.failed(item.id(), ItemResult.Status.PROCESSING_FAILED, String.valueOf(e.getMessage()));
    }
}
