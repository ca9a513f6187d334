package com.ordersaga.events.serde;

import java.util.Optional;
import java.util.UUID;

/**
 * Raised when a message cannot be decoded into an envelope. Carries whatever header fields could
 * still be recovered from the raw text.
 */
public class MalformedEventException extends RuntimeException {

    private final UUID eventId;
    private final String eventType;

    public MalformedEventException(String message, UUID eventId, String eventType, Throwable cause) {
        super(message, cause);
        this.eventId = eventId;
        this.eventType = eventType;
    }

    public MalformedEventException(String message, UUID eventId, String eventType) {
        this(message, eventId, eventType, null);
    }

    public Optional<UUID> getEventId() {
        return Optional.ofNullable(eventId);
    }

    public Optional<String> getEventType() {
        return Optional.ofNullable(eventType);
    }
}
