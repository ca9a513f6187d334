package com.ordersaga.order.saga;

import com.ordersaga.events.CancellationSource;
import com.ordersaga.events.CheckoutInitiatedEvent;
import com.ordersaga.events.DomainEvent;
import com.ordersaga.events.EventEnvelope;
import com.ordersaga.events.InventoryDepletedEvent;
import com.ordersaga.events.InventoryReservedEvent;
import com.ordersaga.events.LineItem;
import com.ordersaga.events.OrderCancelledEvent;
import com.ordersaga.events.OrderConfirmedEvent;
import com.ordersaga.events.OrderCreatedEvent;
import com.ordersaga.events.OrderFulfilledEvent;
import com.ordersaga.events.OrderReservationConfirmedEvent;
import com.ordersaga.events.PaymentFailedEvent;
import com.ordersaga.events.PaymentProcessedEvent;
import com.ordersaga.messaging.outbox.OutboxStore;
import com.ordersaga.order.entity.Order;
import com.ordersaga.order.entity.OrderStatus;
import com.ordersaga.order.repository.OrderRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Drives an order through PENDING, RESERVATION_CONFIRMED, PAID and FULFILLED, or into CANCELLED.
 * <p>
 * Each inbound event has a required current state. Events for unknown orders, or for orders in any
 * other state, are logged and dropped without compensation. Every accepted transition stages its
 * outbound event in the same transaction, carrying the inbound correlation id.
 */
@Service
public class OrderSagaOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(OrderSagaOrchestrator.class);

    private final OrderRepository orderRepository;
    private final OutboxStore outboxStore;
    private final MeterRegistry meterRegistry;

    public OrderSagaOrchestrator(OrderRepository orderRepository,
                                 OutboxStore outboxStore,
                                 MeterRegistry meterRegistry) {
        this.orderRepository = orderRepository;
        this.outboxStore = outboxStore;
        this.meterRegistry = meterRegistry;
    }

    @Transactional
    public void handle(EventEnvelope envelope) {
        DomainEvent payload = envelope.payload();
        String correlationId = envelope.correlationId();
        if (payload instanceof CheckoutInitiatedEvent checkout) {
            createOrder(checkout, correlationId);
        } else if (payload instanceof InventoryReservedEvent reserved) {
            confirmReservation(reserved, correlationId);
        } else if (payload instanceof InventoryDepletedEvent depleted) {
            cancelForDepletedInventory(depleted, correlationId);
        } else if (payload instanceof PaymentProcessedEvent processed) {
            markPaid(processed, correlationId);
        } else if (payload instanceof PaymentFailedEvent failed) {
            cancelForFailedPayment(failed, correlationId);
        } else if (payload instanceof OrderFulfilledEvent fulfilled) {
            markFulfilled(fulfilled);
        } else {
            log.debug("Ignoring event type: {}", envelope.eventType());
        }
    }

    /**
     * Cancels an order still waiting for payment. Returns false when the order moved on in the
     * meantime.
     */
    @Transactional
    public boolean expirePayment(String orderId, Instant cutoff) {
        Optional<Order> candidate = orderRepository.findById(orderId);
        if (candidate.isEmpty()) {
            return false;
        }
        Order order = candidate.get();
        if (order.getStatus() != OrderStatus.RESERVATION_CONFIRMED || !order.getUpdatedAt().isBefore(cutoff)) {
            return false;
        }
        cancel(order, "Payment not received before timeout", CancellationSource.PAYMENT_TIMEOUT,
                order.getCorrelationId());
        return true;
    }

    private void createOrder(CheckoutInitiatedEvent checkout, String correlationId) {
        List<LineItem> items = checkout.items() == null ? List.of() : checkout.items();
        if (checkout.userId() == null || items.isEmpty()) {
            throw new IllegalArgumentException("Checkout requires a user and at least one item");
        }
        BigDecimal totalAmount = checkout.totalAmount() != null
                ? checkout.totalAmount()
                : items.stream()
                        .map(item -> item.price().multiply(BigDecimal.valueOf(item.quantity())))
                        .reduce(BigDecimal.ZERO, BigDecimal::add);

        Order order = new Order(checkout.userId(), totalAmount, correlationId);
        items.forEach(item -> order.addItem(item.productId(), item.quantity(), item.price()));
        orderRepository.save(order);

        stage(order, new OrderCreatedEvent(order.getId(), order.getUserId(), items, totalAmount), correlationId);

        meterRegistry.counter("orders_created_total").increment();
        log.info("Order created: id={}, user={}, items={}, total={}",
                order.getId(), order.getUserId(), items.size(), totalAmount);
    }

    private void confirmReservation(InventoryReservedEvent reserved, String correlationId) {
        findInState(reserved.orderId(), "inventory.reserved", Set.of(OrderStatus.PENDING)).ifPresent(order -> {
            order.updateStatus(OrderStatus.RESERVATION_CONFIRMED);
            stage(order, new OrderReservationConfirmedEvent(order.getId(), order.getUserId(), order.getTotalAmount()),
                    correlationId);
            meterRegistry.counter("orders_reservation_confirmed_total").increment();
            log.info("Order {} status changed: PENDING -> RESERVATION_CONFIRMED", order.getId());
        });
    }

    private void cancelForDepletedInventory(InventoryDepletedEvent depleted, String correlationId) {
        findInState(depleted.orderId(), "inventory.depleted", Set.of(OrderStatus.PENDING)).ifPresent(order -> {
            String reason = "Insufficient inventory for product " + depleted.productId()
                    + (depleted.reason() == null ? "" : ": " + depleted.reason());
            cancel(order, reason, CancellationSource.INVENTORY_DEPLETED, correlationId);
        });
    }

    private void markPaid(PaymentProcessedEvent processed, String correlationId) {
        findInState(processed.orderId(), "payment.processed", Set.of(OrderStatus.RESERVATION_CONFIRMED))
                .ifPresent(order -> {
                    order.updateStatus(OrderStatus.PAID);
                    stage(order, new OrderConfirmedEvent(order.getId(), order.getUserId()), correlationId);
                    meterRegistry.counter("orders_paid_total").increment();
                    log.info("Order {} paid with payment {}", order.getId(), processed.paymentId());
                });
    }

    private void cancelForFailedPayment(PaymentFailedEvent failed, String correlationId) {
        findInState(failed.orderId(), "payment.failed", Set.of(OrderStatus.RESERVATION_CONFIRMED, OrderStatus.PENDING))
                .ifPresent(order -> cancel(order, "Payment failed: " + failed.reason(),
                        CancellationSource.PAYMENT_FAILED, correlationId));
    }

    private void markFulfilled(OrderFulfilledEvent fulfilled) {
        findInState(fulfilled.orderId(), "order.fulfilled", Set.of(OrderStatus.PAID)).ifPresent(order -> {
            order.updateStatus(OrderStatus.FULFILLED);
            meterRegistry.counter("orders_fulfilled_total").increment();
            log.info("Order {} fulfilled, tracking number {}", order.getId(), fulfilled.trackingNumber());
        });
    }

    private void cancel(Order order, String reason, CancellationSource source, String correlationId) {
        OrderStatus previous = order.getStatus();
        order.cancel(reason);
        stage(order, new OrderCancelledEvent(order.getId(), order.getUserId(), reason, source), correlationId);
        meterRegistry.counter("orders_cancelled_total", "source", source.wireName()).increment();
        log.info("Order {} cancelled from {} ({}): {}", order.getId(), previous, source.wireName(), reason);
    }

    private Optional<Order> findInState(String orderId, String eventType, Set<OrderStatus> expected) {
        Optional<Order> order = orderId == null ? Optional.empty() : orderRepository.findById(orderId);
        if (order.isEmpty()) {
            meterRegistry.counter("saga_events_ignored_total", "reason", "unknown_order").increment();
            log.warn("Ignoring {} for unknown order {}", eventType, orderId);
            return Optional.empty();
        }
        if (!expected.contains(order.get().getStatus())) {
            meterRegistry.counter("saga_events_ignored_total", "reason", "wrong_state").increment();
            log.warn("Ignoring {} for order {} in status {}", eventType, orderId, order.get().getStatus());
            return Optional.empty();
        }
        return order;
    }

    private void stage(Order order, DomainEvent event, String correlationId) {
        outboxStore.append(order.getId(), EventEnvelope.wrap(event, correlationId));
    }
}
