package com.ordersaga.order.entity;

import java.util.Set;

public enum OrderStatus {
    PENDING,
    RESERVATION_CONFIRMED,
    PAID,
    FULFILLED,
    CANCELLED;

    public boolean canTransitionTo(OrderStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return allowedTransitions().isEmpty();
    }

    private Set<OrderStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> Set.of(RESERVATION_CONFIRMED, CANCELLED);
            case RESERVATION_CONFIRMED -> Set.of(PAID, CANCELLED);
            case PAID -> Set.of(FULFILLED);
            case FULFILLED, CANCELLED -> Set.of();
        };
    }
}
