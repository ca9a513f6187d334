package com.ordersaga.events;

import java.math.BigDecimal;
import java.util.List;

public record OrderCreatedEvent(
        String orderId,
        String userId,
        List<LineItem> items,
        BigDecimal totalAmount
) implements DomainEvent {}
