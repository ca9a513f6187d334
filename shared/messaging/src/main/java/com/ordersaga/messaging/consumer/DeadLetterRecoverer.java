package com.ordersaga.messaging.consumer;

import com.ordersaga.events.DeadLetterEvent;
import com.ordersaga.events.EventEnvelope;
import com.ordersaga.events.EventTypes;
import com.ordersaga.events.serde.EventCodec;
import com.ordersaga.events.serde.MalformedEventException;
import com.ordersaga.messaging.bus.EventBus;
import com.ordersaga.messaging.idempotency.ProcessedEvent;
import com.ordersaga.messaging.idempotency.ProcessedEventRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.kafka.listener.ConsumerRecordRecoverer;
import org.springframework.kafka.listener.ListenerExecutionFailedException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionOperations;

import java.util.Optional;
import java.util.UUID;

/**
 * Last step of the container's error handling: publishes the failed record to
 * {@value EventTypes#DLQ_EVENTS} and records its event id as processed, so a redelivery is
 * skipped by {@link IdempotentEventConsumer}.
 * <p>
 * A failed publish propagates and the record is redelivered. Once the dead letter is out, a failure
 * to write the ledger row is logged and counted but does not block the partition.
 */
public class DeadLetterRecoverer implements ConsumerRecordRecoverer {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterRecoverer.class);

    static final String UNKNOWN_EVENT_TYPE = "unknown";

    private final EventBus eventBus;
    private final ProcessedEventRepository processedEventRepository;
    private final TransactionOperations transactions;
    private final MeterRegistry meterRegistry;
    private final int maxAttempts;

    public DeadLetterRecoverer(EventBus eventBus,
                               ProcessedEventRepository processedEventRepository,
                               TransactionOperations transactions,
                               MeterRegistry meterRegistry,
                               int maxAttempts) {
        this.eventBus = eventBus;
        this.processedEventRepository = processedEventRepository;
        this.transactions = transactions;
        this.meterRegistry = meterRegistry;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public void accept(ConsumerRecord<?, ?> record, Exception exception) {
        Throwable failure = unwrap(exception);
        String message = record.value() == null ? null : record.value().toString();
        String key = record.key() == null ? null : record.key().toString();

        if (failure instanceof MalformedEventException malformed) {
            deadLetterMalformed(record.topic(), key, message, malformed);
            return;
        }

        EventEnvelope envelope;
        try {
            envelope = EventCodec.decode(message);
        } catch (MalformedEventException e) {
            deadLetterMalformed(record.topic(), key, message, e);
            return;
        }
        if (alreadyRecorded(envelope.eventId())) {
            log.info("Event {} already dead-lettered or processed, skipping", envelope.eventId());
            return;
        }

        DeadLetterEvent deadLetter = new DeadLetterEvent(
                record.topic(), envelope.eventType(), describe(failure), maxAttempts, message);
        eventBus.publish(EventTypes.DLQ_EVENTS, envelope.eventId().toString(),
                EventCodec.encode(EventEnvelope.wrap(deadLetter, envelope.correlationId())));
        record(envelope.eventId(), envelope.eventType());

        meterRegistry.counter("events_dead_lettered_total", "topic", record.topic()).increment();
        log.error("Event {} ({}) dead-lettered after {} attempts", envelope.eventId(), envelope.eventType(),
                maxAttempts, failure);
    }

    private void deadLetterMalformed(String topic, String key, String message, MalformedEventException failure) {
        Optional<UUID> eventId = failure.getEventId();
        if (eventId.isPresent() && alreadyRecorded(eventId.get())) {
            log.info("Malformed event {} already dead-lettered, skipping", eventId.get());
            return;
        }

        String eventType = failure.getEventType().orElse(UNKNOWN_EVENT_TYPE);
        DeadLetterEvent deadLetter = new DeadLetterEvent(topic, eventType, describe(failure), 0, message);
        EventEnvelope envelope = eventId
                .map(id -> EventEnvelope.wrap(deadLetter, id.toString()))
                .orElseGet(() -> EventEnvelope.wrap(deadLetter));
        eventBus.publish(EventTypes.DLQ_EVENTS, eventId.map(UUID::toString).orElse(key), EventCodec.encode(envelope));
        eventId.ifPresent(id -> record(id, eventType));

        meterRegistry.counter("events_dead_lettered_total", "topic", topic).increment();
        log.error("Malformed message on topic {} (key {}) dead-lettered: {}", topic, key, failure.getMessage());
    }

    private boolean alreadyRecorded(UUID eventId) {
        return processedEventRepository.existsById(eventId);
    }

    private void record(UUID eventId, String eventType) {
        try {
            transactions.executeWithoutResult(status -> {
                if (!processedEventRepository.existsById(eventId)) {
                    processedEventRepository.save(new ProcessedEvent(eventId, eventType));
                }
            });
        } catch (DataAccessException | TransactionException e) {
            meterRegistry.counter("events_dead_letter_unrecorded_total").increment();
            log.error("Event {} was dead-lettered but could not be recorded as processed", eventId, e);
        }
    }

    private static Throwable unwrap(Exception exception) {
        if (exception instanceof ListenerExecutionFailedException && exception.getCause() != null) {
            return exception.getCause();
        }
        return exception;
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return failure.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
