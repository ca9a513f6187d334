package com.ordersaga.order.dto;

import com.ordersaga.order.entity.Order;
import com.ordersaga.order.entity.OrderItem;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record OrderResponse(
        String orderId,
        String userId,
        String status,
        BigDecimal totalAmount,
        String cancellationReason,
        List<ItemResponse> items,
        Instant createdAt,
        Instant updatedAt
) {
    public static OrderResponse from(Order order) {
        List<ItemResponse> items = order.getItems().stream()
                .map(ItemResponse::from)
                .toList();
        return new OrderResponse(
                order.getId(),
                order.getUserId(),
                order.getStatus().name(),
                order.getTotalAmount(),
                order.getCancellationReason(),
                items,
                order.getCreatedAt(),
                order.getUpdatedAt()
        );
    }

    public record ItemResponse(String productId, int quantity, BigDecimal price) {
        public static ItemResponse from(OrderItem item) {
            return new ItemResponse(item.getProductId(), item.getQuantity(), item.getPrice());
        }
    }
}
