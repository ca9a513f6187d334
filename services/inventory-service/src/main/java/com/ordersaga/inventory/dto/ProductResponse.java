package com.ordersaga.inventory.dto;

import com.ordersaga.inventory.entity.Product;

import java.math.BigDecimal;
import java.time.Instant;

public record ProductResponse(
        String productId,
        String name,
        String description,
        BigDecimal price,
        int stock,
        Instant updatedAt
) {
    public static ProductResponse from(Product product) {
        return new ProductResponse(
                product.getProductId(),
                product.getName(),
                product.getDescription(),
                product.getPrice(),
                product.getStock(),
                product.getUpdatedAt()
        );
    }
}
