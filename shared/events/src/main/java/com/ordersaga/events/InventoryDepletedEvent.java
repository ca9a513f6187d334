package com.ordersaga.events;

public record InventoryDepletedEvent(
        String orderId,
        String productId,
        String reason
) implements DomainEvent {}
