package com.ordersaga.events;

import java.util.Optional;

/**
 * Typed payload of an {@link EventEnvelope}, one record per event type.
 */
public sealed interface DomainEvent permits
        CheckoutInitiatedEvent,
        OrderCreatedEvent,
        OrderReservationConfirmedEvent,
        OrderConfirmedEvent,
        OrderCancelledEvent,
        OrderFulfilledEvent,
        InventoryReservedEvent,
        InventoryDepletedEvent,
        InventoryLowEvent,
        PaymentProcessedEvent,
        PaymentFailedEvent,
        DeadLetterEvent,
        UnknownEvent {

    /**
     * Describes why this payload can never be applied, or empty when it is well formed. Checked once
     * while decoding.
     */
    default Optional<String> invalidReason() {
        return Optional.empty();
    }
}
