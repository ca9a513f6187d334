package com.ordersaga.events.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ordersaga.events.DomainEvent;
import com.ordersaga.events.EventEnvelope;
import com.ordersaga.events.EventTypes;
import com.ordersaga.events.UnknownEvent;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Converts between {@link EventEnvelope} and its flat JSON wire form:
 * <pre>
 * {"event_id": "...", "event_type": "order.created", "timestamp": "...", "correlation_id": "...",
 *  "order_id": "...", ...}
 * </pre>
 * Decoding happens once, at the bus boundary. Unregistered event types decode to
 * {@link UnknownEvent}.
 */
public final class EventCodec {

    public static final String EVENT_ID = "event_id";
    public static final String EVENT_TYPE = "event_type";
    public static final String TIMESTAMP = "timestamp";
    public static final String CORRELATION_ID = "correlation_id";

    private static final List<String> HEADER_FIELDS = List.of(EVENT_ID, EVENT_TYPE, TIMESTAMP, CORRELATION_ID);

    private EventCodec() {}

    public static EventEnvelope decode(String message) {
        if (message == null || message.isBlank()) {
            throw new MalformedEventException("Message is empty", null, null);
        }
        ObjectMapper mapper = EventObjectMapper.instance();
        JsonNode root;
        try {
            root = mapper.readTree(message);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Message is not valid JSON", null, null, e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEventException("Message is not a JSON object", null, null);
        }

        String eventType = text(root, EVENT_TYPE).orElse(null);
        UUID eventId = text(root, EVENT_ID).map(EventCodec::parseUuid).orElse(null);
        if (eventId == null) {
            throw new MalformedEventException("Missing or invalid event_id", null, eventType);
        }
        if (eventType == null) {
            throw new MalformedEventException("Missing event_type", eventId, null);
        }

        Instant timestamp;
        try {
            timestamp = text(root, TIMESTAMP).map(LenientInstantDeserializer::parse).orElseGet(Instant::now);
        } catch (DateTimeParseException e) {
            throw new MalformedEventException("Invalid timestamp", eventId, eventType, e);
        }
        String correlationId = text(root, CORRELATION_ID).orElse(eventId.toString());

        DomainEvent payload;
        Optional<Class<? extends DomainEvent>> payloadClass = EventTypes.payloadClass(eventType);
        if (payloadClass.isPresent()) {
            try {
                payload = mapper.treeToValue(root, payloadClass.get());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new MalformedEventException(
                        "Payload does not match " + eventType + ": " + e.getMessage(), eventId, eventType, e);
            }
            Optional<String> invalid = payload.invalidReason();
            if (invalid.isPresent()) {
                throw new MalformedEventException("Invalid " + eventType + ": " + invalid.get(), eventId, eventType);
            }
        } else {
            ObjectNode fields = ((ObjectNode) root).deepCopy();
            fields.remove(HEADER_FIELDS);
            payload = new UnknownEvent(fields);
        }
        return new EventEnvelope(eventId, eventType, timestamp, correlationId, payload);
    }

    public static String encode(EventEnvelope envelope) {
        ObjectMapper mapper = EventObjectMapper.instance();
        ObjectNode node = mapper.createObjectNode();
        node.put(EVENT_ID, envelope.eventId().toString());
        node.put(EVENT_TYPE, envelope.eventType());
        node.put(TIMESTAMP, envelope.timestamp().toString());
        node.put(CORRELATION_ID, envelope.correlationId());
        if (envelope.payload() instanceof UnknownEvent unknown) {
            node.setAll(unknown.fields());
        } else {
            ObjectNode fields = mapper.valueToTree(envelope.payload());
            node.setAll(fields);
        }
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event " + envelope.eventId(), e);
        }
    }

    private static Optional<String> text(JsonNode root, String field) {
        JsonNode value = root.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return Optional.empty();
        }
        String text = value.asText();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    private static UUID parseUuid(String value) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
