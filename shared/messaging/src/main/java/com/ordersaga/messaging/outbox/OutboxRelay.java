package com.ordersaga.messaging.outbox;

import com.ordersaga.messaging.bus.EventBus;
import com.ordersaga.messaging.bus.EventPublishException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;

/**
 * Publishes committed outbox rows in creation order, each to the topic named by its event type and
 * keyed by its aggregate id. The first failed send ends the batch so later rows of the same
 * aggregate are never published ahead of it; consecutive failures back the relay off.
 */
@Component
public class OutboxRelay {

    private static final Logger log = LoggerFactory.getLogger(OutboxRelay.class);
    private static final long BASE_BACKOFF_MS = 500;
    private static final long MAX_BACKOFF_MS = 30_000;

    private final OutboxRepository outboxRepository;
    private final EventBus eventBus;
    private final TransactionOperations transactions;
    private final MeterRegistry meterRegistry;
    private final int batchSize;

    private volatile int consecutiveFailures = 0;
    private volatile long nextAllowedRunMs = 0;

    public OutboxRelay(OutboxRepository outboxRepository,
                       EventBus eventBus,
                       TransactionOperations transactions,
                       MeterRegistry meterRegistry,
                       @Value("${outbox.relay.batch-size:100}") int batchSize) {
        this.outboxRepository = outboxRepository;
        this.eventBus = eventBus;
        this.transactions = transactions;
        this.meterRegistry = meterRegistry;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${outbox.relay.interval-ms:2000}")
    public void publishPendingEvents() {
        if (System.currentTimeMillis() < nextAllowedRunMs) {
            return;
        }
        relayOnce();
    }

    /**
     * Claims and publishes one batch.
     *
     * @return the number of rows marked published
     */
    public int relayOnce() {
        Integer published = transactions.execute(status -> publishBatch());
        return published == null ? 0 : published;
    }

    private int publishBatch() {
        List<OutboxEvent> events = outboxRepository.claimUnpublished(batchSize);
        int published = 0;
        for (OutboxEvent event : events) {
            try {
                eventBus.publish(event.getEventType(), event.getAggregateId(), event.getPayload());
            } catch (EventPublishException e) {
                onFailure(event, e);
                break;
            }
            event.markPublished();
            outboxRepository.save(event);
            published++;
            consecutiveFailures = 0;
            meterRegistry.counter("outbox_published_total").increment();
            log.info("Published outbox event {} of type {} for aggregate {}",
                    event.getId(), event.getEventType(), event.getAggregateId());
        }
        return published;
    }

    private void onFailure(OutboxEvent event, EventPublishException e) {
        consecutiveFailures++;
        long backoffMs = Math.min(BASE_BACKOFF_MS * (1L << Math.min(consecutiveFailures, 6)), MAX_BACKOFF_MS);
        nextAllowedRunMs = System.currentTimeMillis() + backoffMs;
        meterRegistry.counter("outbox_publish_failures_total").increment();
        log.warn("Failed to publish outbox event {} of type {}, backing off for {}ms (consecutive failures: {}): {}",
                event.getId(), event.getEventType(), backoffMs, consecutiveFailures, e.getMessage());
    }

    int getConsecutiveFailures() {
        return consecutiveFailures;
    }
}
