package com.ordersaga.events;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public record CheckoutInitiatedEvent(
        String userId,
        List<LineItem> items,
        BigDecimal totalAmount
) implements DomainEvent {

    @Override
    public Optional<String> invalidReason() {
        if (userId == null || userId.isBlank()) {
            return Optional.of("checkout has no user_id");
        }
        if (items == null || items.isEmpty()) {
            return Optional.of("checkout has no items");
        }
        return Optional.empty();
    }
}
