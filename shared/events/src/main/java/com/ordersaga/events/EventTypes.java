package com.ordersaga.events;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Event type names. Every event is published to the topic of the same name.
 */
public final class EventTypes {
    private EventTypes() {}

    public static final String CART_CHECKOUT_INITIATED = "cart.checkout_initiated";

    public static final String ORDER_CREATED = "order.created";
    public static final String ORDER_RESERVATION_CONFIRMED = "order.reservation_confirmed";
    public static final String ORDER_CONFIRMED = "order.confirmed";
    public static final String ORDER_CANCELLED = "order.cancelled";
    public static final String ORDER_FULFILLED = "order.fulfilled";

    public static final String INVENTORY_RESERVED = "inventory.reserved";
    public static final String INVENTORY_DEPLETED = "inventory.depleted";
    public static final String INVENTORY_LOW = "inventory.low";

    public static final String PAYMENT_PROCESSED = "payment.processed";
    public static final String PAYMENT_FAILED = "payment.failed";

    public static final String DLQ_EVENTS = "dlq.events";

    private static final Map<String, Class<? extends DomainEvent>> TYPES = Map.ofEntries(
            Map.entry(CART_CHECKOUT_INITIATED, CheckoutInitiatedEvent.class),
            Map.entry(ORDER_CREATED, OrderCreatedEvent.class),
            Map.entry(ORDER_RESERVATION_CONFIRMED, OrderReservationConfirmedEvent.class),
            Map.entry(ORDER_CONFIRMED, OrderConfirmedEvent.class),
            Map.entry(ORDER_CANCELLED, OrderCancelledEvent.class),
            Map.entry(ORDER_FULFILLED, OrderFulfilledEvent.class),
            Map.entry(INVENTORY_RESERVED, InventoryReservedEvent.class),
            Map.entry(INVENTORY_DEPLETED, InventoryDepletedEvent.class),
            Map.entry(INVENTORY_LOW, InventoryLowEvent.class),
            Map.entry(PAYMENT_PROCESSED, PaymentProcessedEvent.class),
            Map.entry(PAYMENT_FAILED, PaymentFailedEvent.class),
            Map.entry(DLQ_EVENTS, DeadLetterEvent.class)
    );

    public static Set<String> all() {
        return TYPES.keySet();
    }

    public static Optional<Class<? extends DomainEvent>> payloadClass(String eventType) {
        return Optional.ofNullable(TYPES.get(eventType));
    }

    public static String typeOf(DomainEvent payload) {
        for (Map.Entry<String, Class<? extends DomainEvent>> entry : TYPES.entrySet()) {
            if (entry.getValue().isInstance(payload)) {
                return entry.getKey();
            }
        }
        throw new IllegalArgumentException("No event type registered for " + payload.getClass().getSimpleName());
    }
}
