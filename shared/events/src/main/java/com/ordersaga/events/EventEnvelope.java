package com.ordersaga.events;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Common header of every message on the bus. On the wire the header fields and the payload
 * fields share one flat JSON object; see {@link com.ordersaga.events.serde.EventCodec}.
 */
public record EventEnvelope(
        UUID eventId,
        String eventType,
        Instant timestamp,
        String correlationId,
        DomainEvent payload
) {
    public EventEnvelope {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(correlationId, "correlationId");
        Objects.requireNonNull(payload, "payload");
    }

    public static EventEnvelope wrap(DomainEvent payload, String correlationId) {
        return new EventEnvelope(
                UUID.randomUUID(),
                EventTypes.typeOf(payload),
                Instant.now(),
                correlationId,
                payload
        );
    }

    /**
     * Starts a new correlation chain: the envelope's own event id becomes its correlation id.
     */
    public static EventEnvelope wrap(DomainEvent payload) {
        UUID eventId = UUID.randomUUID();
        return new EventEnvelope(eventId, EventTypes.typeOf(payload), Instant.now(), eventId.toString(), payload);
    }
}
