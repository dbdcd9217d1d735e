package com.tapas.drivertips.consumer;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Puts a failed tip event back on its topic so it is delivered again, counting
 * attempts in a header. After the last allowed attempt the event goes to the
 * dead-letter topic instead.
 */
@Component
@Slf4j
public class TipRedeliveryPublisher {

    static final String ATTEMPT_HEADER = "tips-delivery-attempt";
    public static final String DLT_SUFFIX = ".DLT";

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Value("${tips.kafka.max-delivery-attempts:3}")
    private int maxDeliveryAttempts;

    @Value("${tips.kafka.send-timeout-seconds:10}")
    private int sendTimeoutSeconds;

    public TipRedeliveryPublisher(KafkaTemplate<String, String> kafkaTemplate) {
        this.kafkaTemplate = kafkaTemplate;
    }

    /**
     * Blocks until the broker acknowledges the send.
     *
     * @throws KafkaException if the record could not be republished
     */
    public void redeliver(ConsumerRecord<String, String> record) {
        int attempts = deliveryAttempt(record);
        String target = attempts >= maxDeliveryAttempts
                ? record.topic() + DLT_SUFFIX
                : record.topic();

        var out = new ProducerRecord<>(target, record.key(), record.value());
        out.headers().add(ATTEMPT_HEADER,
                String.valueOf(attempts + 1).getBytes(StandardCharsets.UTF_8));

        try {
            kafkaTemplate.send(out).get(sendTimeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KafkaException("Interrupted while redelivering " + describe(record), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new KafkaException("Failed to redeliver " + describe(record), e);
        }

        if (target.endsWith(DLT_SUFFIX)) {
            log.warn("Tip event {} failed {} deliveries, moved to {}", describe(record), attempts, target);
        } else {
            log.info("Tip event {} scheduled for delivery attempt {}", describe(record), attempts + 1);
        }
    }

    /**
     * Number of deliveries this record represents; the first delivery carries no header.
     */
    static int deliveryAttempt(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(ATTEMPT_HEADER);
        if (header == null) {
            return 1;
        }
        try {
            return Integer.parseInt(new String(header.value(), StandardCharsets.UTF_8));
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed {} header on {}", ATTEMPT_HEADER, describe(record));
            return 1;
        }
    }

    static String describe(ConsumerRecord<String, String> record) {
        return record.topic() + "-" + record.partition() + "@" + record.offset();
    }
}
