package com.ordersaga.events;

import java.time.Instant;

public record OrderFulfilledEvent(
        String orderId,
        String userId,
        String trackingNumber,
        Instant shippedAt
) implements DomainEvent {}
