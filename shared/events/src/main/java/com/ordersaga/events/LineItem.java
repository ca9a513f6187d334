package com.ordersaga.events;

import java.math.BigDecimal;

public record LineItem(
        String productId,
        int quantity,
        BigDecimal price
) {}
