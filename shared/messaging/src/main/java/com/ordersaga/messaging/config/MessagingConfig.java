package com.ordersaga.messaging.config;

import com.ordersaga.events.EventTypes;
import com.ordersaga.events.serde.MalformedEventException;
import com.ordersaga.messaging.bus.EventBus;
import com.ordersaga.messaging.bus.KafkaEventBus;
import com.ordersaga.messaging.consumer.DeadLetterRecoverer;
import com.ordersaga.messaging.consumer.IdempotentEventConsumer;
import com.ordersaga.messaging.idempotency.ProcessedEventRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.ExponentialBackOffWithMaxRetries;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;

@Configuration
public class MessagingConfig {

    private static final Logger log = LoggerFactory.getLogger(MessagingConfig.class);

    @Bean
    public EventBus eventBus(KafkaTemplate<String, String> kafkaTemplate,
                             @Value("${messaging.publish-timeout-ms:10000}") long publishTimeoutMs) {
        return new KafkaEventBus(kafkaTemplate, Duration.ofMillis(publishTimeoutMs));
    }

    @Bean
    public IdempotentEventConsumer idempotentEventConsumer(ProcessedEventRepository processedEventRepository,
                                                           TransactionOperations transactionOperations,
                                                           MeterRegistry meterRegistry) {
        return new IdempotentEventConsumer(processedEventRepository, transactionOperations, meterRegistry);
    }

    @Bean
    public DeadLetterRecoverer deadLetterRecoverer(EventBus eventBus,
                                                   ProcessedEventRepository processedEventRepository,
                                                   TransactionOperations transactionOperations,
                                                   MeterRegistry meterRegistry,
                                                   @Value("${messaging.consumer.max-attempts:3}") int maxAttempts) {
        return new DeadLetterRecoverer(eventBus, processedEventRepository, transactionOperations,
                meterRegistry, maxAttempts);
    }

    @Bean
    public KafkaAdmin.NewTopics sagaTopics(@Value("${messaging.topics.partitions:3}") int partitions,
                                           @Value("${messaging.topics.replicas:1}") short replicas) {
        return new KafkaAdmin.NewTopics(EventTypes.all().stream()
                .sorted()
                .map(name -> TopicBuilder.name(name).partitions(partitions).replicas(replicas).build())
                .toArray(NewTopic[]::new));
    }

    /**
     * Retries a failed record {@code max-attempts} times in total with exponential back-off, then hands
     * it to the {@link DeadLetterRecoverer}. Malformed messages go to the recoverer on the first failure.
     */
    @Bean
    public CommonErrorHandler kafkaErrorHandler(
            DeadLetterRecoverer deadLetterRecoverer,
            MeterRegistry meterRegistry,
            @Value("${messaging.consumer.max-attempts:3}") int maxAttempts,
            @Value("${messaging.consumer.initial-interval-ms:1000}") long initialIntervalMs,
            @Value("${messaging.consumer.multiplier:2.0}") double multiplier,
            @Value("${messaging.consumer.max-interval-ms:4000}") long maxIntervalMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("messaging.consumer.max-attempts must be at least 1, got " + maxAttempts);
        }
        ExponentialBackOffWithMaxRetries backOff = new ExponentialBackOffWithMaxRetries(maxAttempts - 1);
        backOff.setInitialInterval(initialIntervalMs);
        backOff.setMultiplier(multiplier);
        backOff.setMaxInterval(maxIntervalMs);

        DefaultErrorHandler handler = new DefaultErrorHandler(deadLetterRecoverer, backOff);
        handler.addNotRetryableExceptions(MalformedEventException.class);
        handler.setRetryListeners((ConsumerRecord<?, ?> record, Exception ex, int deliveryAttempt) -> {
            meterRegistry.counter("events_failed_deliveries_total", "topic", record.topic()).increment();
            log.warn("Delivery {} of record {}-{}@{} failed: {}",
                    deliveryAttempt, record.topic(), record.partition(), record.offset(), ex.getMessage());
        });
        return handler;
    }
}
