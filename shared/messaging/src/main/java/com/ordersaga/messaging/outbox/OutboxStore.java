package com.ordersaga.messaging.outbox;

import com.ordersaga.events.EventEnvelope;
import com.ordersaga.events.serde.EventCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stages an outbound event in the caller's transaction. Nothing reaches the bus until that
 * transaction commits and {@link OutboxRelay} picks the row up.
 */
@Component
public class OutboxStore {

    private static final Logger log = LoggerFactory.getLogger(OutboxStore.class);

    private final OutboxRepository outboxRepository;

    public OutboxStore(OutboxRepository outboxRepository) {
        this.outboxRepository = outboxRepository;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent append(String aggregateId, EventEnvelope envelope) {
        OutboxEvent event = new OutboxEvent(aggregateId, envelope.eventType(), EventCodec.encode(envelope));
        outboxRepository.save(event);
        log.debug("Staged {} event {} for aggregate {}", envelope.eventType(), envelope.eventId(), aggregateId);
        return event;
    }
}
