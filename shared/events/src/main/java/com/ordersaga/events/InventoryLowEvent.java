package com.ordersaga.events;

public record InventoryLowEvent(
        String productId,
        int currentStock,
        int threshold
) implements DomainEvent {}
