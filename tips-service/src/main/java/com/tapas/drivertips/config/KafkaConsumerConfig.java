package com.tapas.drivertips.config;

import com.tapas.drivertips.consumer.TipRedeliveryPublisher;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.KafkaOperations;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.ExponentialBackOffWithMaxRetries;

/**
 * Batch listener wiring for the tip-events topic.
 * <p>
 * A batch is replayed only when the listener could not hand its failed records back to
 * Kafka. Replays back off exponentially; once they are exhausted every record of the
 * batch is parked on {@code <topic>.DLT}. If parking fails too the batch is sought
 * again, so offsets are never committed past a record that was neither applied nor
 * parked.
 */
@Configuration
public class KafkaConsumerConfig {

    private static final Logger log = LoggerFactory.getLogger(KafkaConsumerConfig.class);

    @Value("${tips.kafka.listener-concurrency:1}")
    private int concurrency;

    @Value("${tips.kafka.retry.max-retries:5}")
    private int maxRetries;

    @Value("${tips.kafka.retry.initial-interval-ms:1000}")
    private long initialIntervalMs;

    @Value("${tips.kafka.retry.max-interval-ms:30000}")
    private long maxIntervalMs;

    @Bean
    public ConsumerFactory<String, String> consumerFactory(KafkaProperties kafkaProperties) {
        return new DefaultKafkaConsumerFactory<>(kafkaProperties.buildConsumerProperties());
    }

    @Bean
    public CommonErrorHandler tipsErrorHandler(KafkaOperations<String, String> kafkaOperations) {
        DeadLetterPublishingRecoverer recoverer =
                new DeadLetterPublishingRecoverer(kafkaOperations, KafkaConsumerConfig::deadLetterDestination);
        return new DefaultErrorHandler(recoverer, batchBackOff());
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory(
            ConsumerFactory<String, String> consumerFactory,
            CommonErrorHandler tipsErrorHandler) {

        var factory = new ConcurrentKafkaListenerContainerFactory<String, String>();
        factory.setConsumerFactory(consumerFactory);
        factory.setConcurrency(concurrency);
        factory.setBatchListener(true); // max.poll.records bounds the batch
        factory.setCommonErrorHandler(tipsErrorHandler);
        return factory;
    }

    ExponentialBackOffWithMaxRetries batchBackOff() {
        var backOff = new ExponentialBackOffWithMaxRetries(maxRetries);
        backOff.setInitialInterval(initialIntervalMs);
        backOff.setMultiplier(2.0);
        backOff.setMaxInterval(maxIntervalMs);
        return backOff;
    }

    // negative partition lets the producer pick one
    static TopicPartition deadLetterDestination(ConsumerRecord<?, ?> record, Exception e) {
        log.error("Parking tip event {}-{}@{} after exhausted retries",
                record.topic(), record.partition(), record.offset(), e);
        return new TopicPartition(record.topic() + TipRedeliveryPublisher.DLT_SUFFIX, -1);
    }
}
