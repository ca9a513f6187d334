package com.ordersaga.payment.entity;

public enum PaymentStatus {
    SUCCEEDED,
    FAILED
}
