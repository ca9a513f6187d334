package com.ordersaga.order.saga;

import com.ordersaga.events.CancellationSource;
import com.ordersaga.events.CheckoutInitiatedEvent;
import com.ordersaga.events.DomainEvent;
import com.ordersaga.events.EventEnvelope;
import com.ordersaga.events.EventTypes;
import com.ordersaga.events.InventoryDepletedEvent;
import com.ordersaga.events.InventoryReservedEvent;
import com.ordersaga.events.LineItem;
import com.ordersaga.events.OrderCancelledEvent;
import com.ordersaga.events.OrderCreatedEvent;
import com.ordersaga.events.OrderFulfilledEvent;
import com.ordersaga.events.OrderReservationConfirmedEvent;
import com.ordersaga.events.PaymentFailedEvent;
import com.ordersaga.events.PaymentProcessedEvent;
import com.ordersaga.messaging.outbox.OutboxStore;
import com.ordersaga.order.entity.Order;
import com.ordersaga.order.entity.OrderStatus;
import com.ordersaga.order.repository.OrderRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrderSagaOrchestratorTest {

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private OutboxStore outboxStore;

    private final Map<String, Order> orders = new HashMap<>();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private OrderSagaOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new OrderSagaOrchestrator(orderRepository, outboxStore, meterRegistry);
    }

    @Test
    void checkoutCreatesPendingOrderAndStagesOrderCreated() {
        stubSaves();
        List<LineItem> items = List.of(
                new LineItem("PROD-A", 2, new BigDecimal("10.00")),
                new LineItem("PROD-B", 1, new BigDecimal("5.50")));

        orchestrator.handle(event(new CheckoutInitiatedEvent("user-1", items, new BigDecimal("25.50")), "corr-1"));

        assertThat(orders).hasSize(1);
        Order order = orders.values().iterator().next();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(order.getItems()).hasSize(2);
        assertThat(order.getTotalAmount()).isEqualByComparingTo("25.50");

        List<EventEnvelope> staged = staged();
        assertThat(staged).hasSize(1);
        EventEnvelope created = staged.get(0);
        assertThat(created.eventType()).isEqualTo(EventTypes.ORDER_CREATED);
        assertThat(created.correlationId()).isEqualTo("corr-1");
        assertThat(created.payload()).isEqualTo(
                new OrderCreatedEvent(order.getId(), "user-1", items, new BigDecimal("25.50")));
        assertThat(meterRegistry.counter("orders_created_total").count()).isEqualTo(1.0);
    }

    @Test
    void checkoutWithoutTotalSumsTheLines() {
        stubSaves();
        orchestrator.handle(event(new CheckoutInitiatedEvent("user-1",
                List.of(new LineItem("PROD-A", 3, new BigDecimal("2.50"))), null), "corr"));

        assertThat(orders.values().iterator().next().getTotalAmount()).isEqualByComparingTo("7.50");
    }

    @Test
    void reservationConfirmsPendingOrder() {
        Order order = pendingOrder();

        orchestrator.handle(event(new InventoryReservedEvent(order.getId(), "PROD-A", 1, List.of()), "corr-2"));

        assertThat(order.getStatus()).isEqualTo(OrderStatus.RESERVATION_CONFIRMED);
        assertThat(staged()).singleElement().satisfies(envelope -> {
            assertThat(envelope.correlationId()).isEqualTo("corr-2");
            assertThat(envelope.payload()).isEqualTo(new OrderReservationConfirmedEvent(
                    order.getId(), order.getUserId(), order.getTotalAmount()));
        });
    }

    @Test
    void depletedInventoryCancelsWithoutStockRelease() {
        Order order = pendingOrder();

        orchestrator.handle(event(new InventoryDepletedEvent(order.getId(), "PROD-A", "insufficient_stock"), "c"));

        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        OrderCancelledEvent cancelled = (OrderCancelledEvent) staged().get(0).payload();
        assertThat(cancelled.cancellationSource()).isEqualTo(CancellationSource.INVENTORY_DEPLETED);
        assertThat(cancelled.cancellationSource().releasesStock()).isFalse();
        assertThat(cancelled.reason()).contains("PROD-A");
    }

    @Test
    void paymentProcessedMarksOrderPaidAndConfirms() {
        Order order = reservedOrder();

        orchestrator.handle(event(new PaymentProcessedEvent("PAY-1", order.getId(), order.getUserId(),
                order.getTotalAmount(), "USD", "card"), "c"));

        assertThat(order.getStatus()).isEqualTo(OrderStatus.PAID);
        assertThat(staged()).singleElement()
                .satisfies(envelope -> assertThat(envelope.eventType()).isEqualTo(EventTypes.ORDER_CONFIRMED));
    }

    @Test
    void paymentFailureCancelsAndRequestsRelease() {
        Order order = reservedOrder();

        orchestrator.handle(event(new PaymentFailedEvent(order.getId(), order.getUserId(), "card_declined"), "c"));

        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        OrderCancelledEvent cancelled = (OrderCancelledEvent) staged().get(0).payload();
        assertThat(cancelled.cancellationSource()).isEqualTo(CancellationSource.PAYMENT_FAILED);
        assertThat(cancelled.reason()).contains("card_declined");
    }

    @Test
    void fulfilmentCompletesPaidOrderWithoutOutboundEvent() {
        Order order = reservedOrder();
        order.updateStatus(OrderStatus.PAID);

        orchestrator.handle(event(new OrderFulfilledEvent(order.getId(), order.getUserId(), "TRK-1", Instant.now()), "c"));

        assertThat(order.getStatus()).isEqualTo(OrderStatus.FULFILLED);
        assertThat(staged()).isEmpty();
    }

    @Test
    void eventsForWrongStateAreIgnored() {
        Order order = pendingOrder();

        orchestrator.handle(event(new PaymentProcessedEvent("PAY-1", order.getId(), "u", BigDecimal.ONE, "USD", "card"), "c"));
        orchestrator.handle(event(new OrderFulfilledEvent(order.getId(), "u", "TRK", Instant.now()), "c"));

        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(staged()).isEmpty();
        assertThat(meterRegistry.counter("saga_events_ignored_total", "reason", "wrong_state").count()).isEqualTo(2.0);
    }

    @Test
    void eventsForUnknownOrdersAreIgnored() {
        when(orderRepository.findById("ORD-DOESNOTEXIST")).thenReturn(Optional.empty());

        orchestrator.handle(event(new InventoryReservedEvent("ORD-DOESNOTEXIST", "PROD-A", 1, List.of()), "c"));

        verifyNoInteractions(outboxStore);
        assertThat(meterRegistry.counter("saga_events_ignored_total", "reason", "unknown_order").count()).isEqualTo(1.0);
    }

    @Test
    void cancelledOrderIgnoresLatePayment() {
        Order order = reservedOrder();
        orchestrator.handle(event(new PaymentFailedEvent(order.getId(), order.getUserId(), "expired_card"), "c"));
        clearInvocations(outboxStore);

        orchestrator.handle(event(new PaymentProcessedEvent("PAY-2", order.getId(), "u", BigDecimal.ONE, "USD", "card"), "c"));

        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(staged()).isEmpty();
    }

    @Test
    void paymentFailureBeforeReservationCancelsPendingOrder() {
        Order order = pendingOrder();

        orchestrator.handle(event(new PaymentFailedEvent(order.getId(), order.getUserId(), "fraud_suspected"), "corr-3"));

        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(staged()).singleElement().satisfies(envelope -> {
            assertThat(envelope.eventType()).isEqualTo(EventTypes.ORDER_CANCELLED);
            assertThat(envelope.correlationId()).isEqualTo("corr-3");
            OrderCancelledEvent cancelled = (OrderCancelledEvent) envelope.payload();
            assertThat(cancelled.cancellationSource()).isEqualTo(CancellationSource.PAYMENT_FAILED);
            assertThat(cancelled.reason()).contains("fraud_suspected");
        });
        assertThat(meterRegistry.counter("orders_cancelled_total", "source", "payment_failed").count()).isEqualTo(1.0);
    }

    @Test
    void reservationForCancelledOrderIsIgnored() {
        Order order = pendingOrder();
        order.cancel("Cancelled by user");

        orchestrator.handle(event(new InventoryReservedEvent(order.getId(), "PROD-A", 2, List.of()), "c"));

        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        verifyNoInteractions(outboxStore);
        assertThat(meterRegistry.counter("saga_events_ignored_total", "reason", "wrong_state").count()).isEqualTo(1.0);
    }

    @Test
    void expirePaymentCancelsStaleReservationWithTimeoutSource() {
        Order order = reservedOrder();

        boolean expired = orchestrator.expirePayment(order.getId(), Instant.now().plusSeconds(1));

        assertThat(expired).isTrue();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        OrderCancelledEvent cancelled = (OrderCancelledEvent) staged().get(0).payload();
        assertThat(cancelled.cancellationSource()).isEqualTo(CancellationSource.PAYMENT_TIMEOUT);
        assertThat(staged().get(0).correlationId()).isEqualTo(order.getCorrelationId());
    }

    @Test
    void expirePaymentLeavesRecentlyUpdatedOrderAlone() {
        Order order = reservedOrder();

        boolean expired = orchestrator.expirePayment(order.getId(), order.getUpdatedAt().minusSeconds(60));

        assertThat(expired).isFalse();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.RESERVATION_CONFIRMED);
    }

    private Order pendingOrder() {
        Order order = new Order("user-1", new BigDecimal("20.00"), "corr-order");
        order.addItem("PROD-A", 2, new BigDecimal("10.00"));
        when(orderRepository.findById(order.getId())).thenReturn(Optional.of(order));
        return order;
    }

    private Order reservedOrder() {
        Order order = pendingOrder();
        order.updateStatus(OrderStatus.RESERVATION_CONFIRMED);
        return order;
    }

    private void stubSaves() {
        when(orderRepository.save(any(Order.class))).thenAnswer(inv -> {
            Order order = inv.getArgument(0);
            orders.put(order.getId(), order);
            return order;
        });
    }

    private List<EventEnvelope> staged() {
        ArgumentCaptor<EventEnvelope> captor = ArgumentCaptor.forClass(EventEnvelope.class);
        verify(outboxStore, atLeast(0)).append(anyString(), captor.capture());
        return captor.getAllValues();
    }

    private static EventEnvelope event(DomainEvent payload, String correlationId) {
        return EventEnvelope.wrap(payload, correlationId);
    }
}
