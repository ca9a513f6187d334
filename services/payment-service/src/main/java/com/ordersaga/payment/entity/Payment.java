package com.ordersaga.payment.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

@Entity
@Table(name = "payments")
public class Payment {

    public static final String DEFAULT_CURRENCY = "USD";
    public static final String DEFAULT_METHOD = "card";

    @Id
    @Column(name = "payment_id", length = 32)
    private String id;

    @Column(name = "order_id", nullable = false, unique = true, length = 32)
    private String orderId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(nullable = false, length = 32)
    private String method;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PaymentStatus status;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected Payment() {}

    private Payment(String orderId, String userId, BigDecimal amount, PaymentStatus status, String failureReason) {
        this.id = "PAY-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12).toUpperCase(Locale.ROOT);
        this.orderId = orderId;
        this.userId = userId;
        this.amount = amount;
        this.currency = DEFAULT_CURRENCY;
        this.method = DEFAULT_METHOD;
        this.status = status;
        this.failureReason = failureReason;
        this.createdAt = Instant.now();
    }

    public static Payment succeeded(String orderId, String userId, BigDecimal amount) {
        return new Payment(orderId, userId, amount, PaymentStatus.SUCCEEDED, null);
    }

    public static Payment failed(String orderId, String userId, BigDecimal amount, String reason) {
        return new Payment(orderId, userId, amount, PaymentStatus.FAILED, reason);
    }

    public String getId() { return id; }
    public String getOrderId() { return orderId; }
    public String getUserId() { return userId; }
    public BigDecimal getAmount() { return amount; }
    public String getCurrency() { return currency; }
    public String getMethod() { return method; }
    public PaymentStatus getStatus() { return status; }
    public String getFailureReason() { return failureReason; }
    public Instant getCreatedAt() { return createdAt; }
}
