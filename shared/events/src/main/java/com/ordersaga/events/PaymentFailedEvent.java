package com.ordersaga.events;

public record PaymentFailedEvent(
        String orderId,
        String userId,
        String reason
) implements DomainEvent {}
