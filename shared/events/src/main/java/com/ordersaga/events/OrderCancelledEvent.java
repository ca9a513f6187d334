package com.ordersaga.events;

public record OrderCancelledEvent(
        String orderId,
        String userId,
        String reason,
        CancellationSource cancellationSource
) implements DomainEvent {}
