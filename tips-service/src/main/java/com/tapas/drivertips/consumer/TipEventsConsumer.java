package com.tapas.drivertips.consumer;

import com.tapas.drivertips.dto.BatchReport;
import com.tapas.drivertips.dto.InboundTip;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class TipEventsConsumer {

    private static final Logger log =
            LoggerFactory.getLogger(TipEventsConsumer.class);

    private final TipBatchConsumer batchConsumer;
    private final TipRedeliveryPublisher redeliveryPublisher;

    public TipEventsConsumer(TipBatchConsumer batchConsumer,
                             TipRedeliveryPublisher redeliveryPublisher) {
        this.batchConsumer = batchConsumer;
        this.redeliveryPublisher = redeliveryPublisher;
    }

    @KafkaListener(
            topics = "${tips.kafka.topic:tip-events}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(List<ConsumerRecord<String, String>> records) {
        Map<String, ConsumerRecord<String, String>> byId = new LinkedHashMap<>();
        List<InboundTip> items = new ArrayList<>(records.size());
        for (ConsumerRecord<String, String> record : records) {
            String id = TipRedeliveryPublisher.describe(record);
            byId.put(id, record);
            items.add(new InboundTip(id, record.value()));
        }

        BatchReport report = batchConsumer.processBatch(items);

        try {
            for (String failedId : report.failedIds()) {
                redeliveryPublisher.redeliver(byId.get(failedId));
            }
        } catch (Exception e) {
            log.error("Failed to redeliver tip events, batch will be retried", e);
            throw e; // Kafka retry
        }
    }
}
