package com.ordersaga.events;

import java.math.BigDecimal;

public record OrderReservationConfirmedEvent(
        String orderId,
        String userId,
        BigDecimal totalAmount
) implements DomainEvent {}
