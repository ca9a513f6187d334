package com.ordersaga.events;

import java.math.BigDecimal;

public record PaymentProcessedEvent(
        String paymentId,
        String orderId,
        String userId,
        BigDecimal amount,
        String currency,
        String method
) implements DomainEvent {}
