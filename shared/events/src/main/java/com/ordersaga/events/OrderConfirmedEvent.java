package com.ordersaga.events;

public record OrderConfirmedEvent(
        String orderId,
        String userId
) implements DomainEvent {}
