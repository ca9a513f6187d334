package com.ordersaga.messaging.consumer;

import com.ordersaga.events.EventEnvelope;
import com.ordersaga.events.serde.EventCodec;
import com.ordersaga.events.serde.MalformedEventException;
import com.ordersaga.messaging.idempotency.ProcessedEvent;
import com.ordersaga.messaging.idempotency.ProcessedEventRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

import java.util.UUID;

/**
 * Runs an {@link EventHandler} at most once per event id.
 * <p>
 * The handler runs in a local transaction that checks the processed-events ledger, applies the
 * event and records its id, so domain rows, outbox rows and the ledger row commit together.
 * Failures propagate to the listener container, whose error handler retries the record and finally
 * hands it to {@link DeadLetterRecoverer}. A {@link MalformedEventException} is never retried.
 */
public class IdempotentEventConsumer {

    private static final Logger log = LoggerFactory.getLogger(IdempotentEventConsumer.class);

    private final ProcessedEventRepository processedEventRepository;
    private final TransactionOperations transactions;
    private final MeterRegistry meterRegistry;

    public IdempotentEventConsumer(ProcessedEventRepository processedEventRepository,
                                   TransactionOperations transactions,
                                   MeterRegistry meterRegistry) {
        this.processedEventRepository = processedEventRepository;
        this.transactions = transactions;
        this.meterRegistry = meterRegistry;
    }

    public ConsumeOutcome consume(String topic, String key, String message, EventHandler handler) {
        EventEnvelope envelope = EventCodec.decode(message);

        UUID eventId = envelope.eventId();
        if (processedEventRepository.existsById(eventId)) {
            meterRegistry.counter("events_duplicate_total", "topic", topic).increment();
            log.info("Event {} ({}) already processed, skipping", eventId, envelope.eventType());
            return ConsumeOutcome.DUPLICATE;
        }

        Boolean applied;
        try {
            applied = transactions.execute(status -> applyOnce(envelope, handler));
        } catch (OutOfMemoryError e) {
            throw e;
        } catch (Error e) {
            throw new EventHandlingException("Handler for event " + eventId + " (key " + key + ") raised " + e, e);
        }

        if (Boolean.TRUE.equals(applied)) {
            meterRegistry.counter("events_processed_total", "topic", topic).increment();
            log.debug("Event {} ({}) processed", eventId, envelope.eventType());
            return ConsumeOutcome.PROCESSED;
        }
        meterRegistry.counter("events_duplicate_total", "topic", topic).increment();
        return ConsumeOutcome.DUPLICATE;
    }

    private boolean applyOnce(EventEnvelope envelope, EventHandler handler) {
        if (processedEventRepository.existsById(envelope.eventId())) {
            return false;
        }
        handler.handle(envelope);
        processedEventRepository.save(new ProcessedEvent(envelope.eventId(), envelope.eventType()));
        return true;
    }
}
