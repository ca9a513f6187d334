package com.ordersaga.events;

import java.util.List;

/**
 * Emitted once per order after every line was reserved. {@code productId} and {@code quantity}
 * describe the first line; {@code items} lists all of them.
 */
public record InventoryReservedEvent(
        String orderId,
        String productId,
        int quantity,
        List<LineItem> items
) implements DomainEvent {}
