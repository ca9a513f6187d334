package com.ordersaga.inventory.repository;

public record StockSnapshot(String productId, int stock, long version) {}
