package com.ordersaga.order.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Entity
@Table(name = "orders")
public class Order {

    @Id
    @Column(name = "order_id")
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderStatus status;

    @Column(name = "total_amount", nullable = false)
    private BigDecimal totalAmount;

    @Column(name = "correlation_id", nullable = false)
    private String correlationId;

    @Column(name = "cancellation_reason")
    private String cancellationReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNumber")
    private List<OrderItem> items = new ArrayList<>();

    protected Order() {}

    public Order(String userId, BigDecimal totalAmount, String correlationId) {
        this.id = newOrderId();
        this.userId = userId;
        this.status = OrderStatus.PENDING;
        this.totalAmount = totalAmount;
        this.correlationId = correlationId;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    /**
     * {@code ORD-} followed by 12 upper-case hex characters.
     */
    static String newOrderId() {
        return "ORD-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12).toUpperCase(Locale.ROOT);
    }

    public void addItem(String productId, int quantity, BigDecimal price) {
        items.add(new OrderItem(this, items.size(), productId, quantity, price));
    }

    public boolean updateStatus(OrderStatus newStatus) {
        if (!this.status.canTransitionTo(newStatus)) {
            return false;
        }
        this.status = newStatus;
        this.updatedAt = Instant.now();
        return true;
    }

    public boolean cancel(String reason) {
        if (!updateStatus(OrderStatus.CANCELLED)) {
            return false;
        }
        this.cancellationReason = reason;
        return true;
    }

    public String getId() { return id; }
    public String getUserId() { return userId; }
    public OrderStatus getStatus() { return status; }
    public BigDecimal getTotalAmount() { return totalAmount; }
    public String getCorrelationId() { return correlationId; }
    public String getCancellationReason() { return cancellationReason; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Long getVersion() { return version; }
    public List<OrderItem> getItems() { return items; }
}
