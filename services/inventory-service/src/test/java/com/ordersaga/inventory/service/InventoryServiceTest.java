package com.ordersaga.inventory.service;

import com.ordersaga.events.CancellationSource;
import com.ordersaga.events.EventEnvelope;
import com.ordersaga.events.EventTypes;
import com.ordersaga.events.InventoryDepletedEvent;
import com.ordersaga.events.InventoryLowEvent;
import com.ordersaga.events.InventoryReservedEvent;
import com.ordersaga.events.LineItem;
import com.ordersaga.events.OrderCancelledEvent;
import com.ordersaga.events.OrderCreatedEvent;
import com.ordersaga.inventory.entity.StockReservation;
import com.ordersaga.inventory.repository.StockReservationRepository;
import com.ordersaga.messaging.outbox.OutboxStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InventoryServiceTest {

    private static final String ORDER = "ORD-BBBBBBBBBBBB";

    @Mock
    private InventoryLedger ledger;

    @Mock
    private StockReservationRepository reservationRepository;

    @Mock
    private OutboxStore outboxStore;

    private InventoryService inventoryService;

    @BeforeEach
    void setUp() {
        inventoryService = new InventoryService(ledger, reservationRepository, outboxStore, new SimpleMeterRegistry(), 10);
    }

    @Test
    void reservesAllLinesAndStagesOneReservedEvent() {
        List<LineItem> items = List.of(
                new LineItem("PROD-A", 2, new BigDecimal("5.00")),
                new LineItem("PROD-B", 1, new BigDecimal("7.00")));
        when(ledger.reserve(ORDER, "PROD-A", 2)).thenReturn(ReservationOutcome.reserved(40));
        when(ledger.reserve(ORDER, "PROD-B", 1)).thenReturn(ReservationOutcome.reserved(30));

        inventoryService.handle(orderCreated(items, "corr-9"));

        assertThat(staged()).singleElement().satisfies(envelope -> {
            assertThat(envelope.correlationId()).isEqualTo("corr-9");
            assertThat(envelope.payload()).isEqualTo(new InventoryReservedEvent(ORDER, "PROD-A", 2, items));
        });
        assertThat(aggregates()).containsExactly(ORDER);
    }

    @Test
    void stagesLowStockAlertKeyedByProduct() {
        List<LineItem> items = List.of(new LineItem("PROD-A", 3, BigDecimal.ONE));
        when(ledger.reserve(ORDER, "PROD-A", 3)).thenReturn(ReservationOutcome.reserved(9));

        inventoryService.handle(orderCreated(items, "c"));

        assertThat(staged()).extracting(EventEnvelope::eventType)
                .containsExactly(EventTypes.INVENTORY_RESERVED, EventTypes.INVENTORY_LOW);
        assertThat(staged().get(1).payload()).isEqualTo(new InventoryLowEvent("PROD-A", 9, 10));
        assertThat(aggregates()).containsExactly(ORDER, "PROD-A");
    }

    @Test
    void noLowStockAlertAtThreshold() {
        when(ledger.reserve(ORDER, "PROD-A", 1)).thenReturn(ReservationOutcome.reserved(10));

        inventoryService.handle(orderCreated(List.of(new LineItem("PROD-A", 1, BigDecimal.ONE)), "c"));

        assertThat(staged()).extracting(EventEnvelope::eventType).containsExactly(EventTypes.INVENTORY_RESERVED);
    }

    @Test
    void rejectedLineUndoesEarlierLinesAndStagesOneDepletedEvent() {
        List<LineItem> items = List.of(
                new LineItem("PROD-A", 2, BigDecimal.ONE),
                new LineItem("PROD-B", 5, BigDecimal.ONE),
                new LineItem("PROD-C", 1, BigDecimal.ONE));
        when(ledger.reserve(ORDER, "PROD-A", 2)).thenReturn(ReservationOutcome.reserved(3));
        when(ledger.reserve(ORDER, "PROD-B", 5)).thenReturn(
                ReservationOutcome.rejected(ReservationOutcome.Status.INSUFFICIENT_STOCK, 4));

        inventoryService.handle(orderCreated(items, "c"));

        verify(ledger).release(ORDER, "PROD-A", 2);
        verify(ledger, never()).reserve(ORDER, "PROD-C", 1);
        assertThat(staged()).singleElement().satisfies(envelope ->
                assertThat(envelope.payload()).isEqualTo(
                        new InventoryDepletedEvent(ORDER, "PROD-B", "insufficient_stock")));
    }

    @Test
    void linesOfTheSameProductAreReservedTogether() {
        List<LineItem> items = List.of(
                new LineItem("PROD-A", 1, BigDecimal.ONE),
                new LineItem("PROD-A", 2, BigDecimal.ONE));
        when(ledger.reserve(ORDER, "PROD-A", 3)).thenReturn(ReservationOutcome.reserved(20));

        inventoryService.handle(orderCreated(items, "c"));

        verify(ledger).reserve(ORDER, "PROD-A", 3);
        assertThat(staged()).singleElement().satisfies(envelope ->
                assertThat(envelope.payload()).isEqualTo(new InventoryReservedEvent(ORDER, "PROD-A", 3, items)));
    }

    @Test
    void reservedEventCarriesTheMergedQuantityOfTheFirstProduct() {
        List<LineItem> items = List.of(
                new LineItem("PROD-A", 1, BigDecimal.ONE),
                new LineItem("PROD-B", 4, BigDecimal.ONE),
                new LineItem("PROD-A", 2, BigDecimal.ONE));
        when(ledger.reserve(ORDER, "PROD-A", 3)).thenReturn(ReservationOutcome.reserved(50));
        when(ledger.reserve(ORDER, "PROD-B", 4)).thenReturn(ReservationOutcome.reserved(50));

        inventoryService.handle(orderCreated(items, "c"));

        InventoryReservedEvent reserved = (InventoryReservedEvent) staged().get(0).payload();
        assertThat(reserved.productId()).isEqualTo("PROD-A");
        assertThat(reserved.quantity()).isEqualTo(3);
        assertThat(reserved.items()).isEqualTo(items);
    }

    @Test
    void productsAreReservedInProductIdOrder() {
        List<LineItem> items = List.of(
                new LineItem("PROD-C", 1, BigDecimal.ONE),
                new LineItem("PROD-A", 1, BigDecimal.ONE),
                new LineItem("PROD-B", 1, BigDecimal.ONE));
        when(ledger.reserve(anyString(), anyString(), anyInt())).thenReturn(ReservationOutcome.reserved(50));

        inventoryService.handle(orderCreated(items, "c"));

        InOrder order = inOrder(ledger);
        order.verify(ledger).reserve(ORDER, "PROD-A", 1);
        order.verify(ledger).reserve(ORDER, "PROD-B", 1);
        order.verify(ledger).reserve(ORDER, "PROD-C", 1);
        assertThat(((InventoryReservedEvent) staged().get(0).payload()).productId()).isEqualTo("PROD-C");
    }

    @Test
    void repeatedOrderCreatedIsIgnoredWhenReservationsExist() {
        when(reservationRepository.existsByOrderId(ORDER)).thenReturn(true);

        inventoryService.handle(orderCreated(List.of(new LineItem("PROD-A", 1, BigDecimal.ONE)), "c"));

        verify(ledger, never()).reserve(anyString(), anyString(), anyInt());
        verifyNoInteractions(outboxStore);
    }

    @Test
    void paymentCancellationsReleaseEveryReservation() {
        when(reservationRepository.findByOrderId(ORDER)).thenReturn(List.of(
                new StockReservation(ORDER, "PROD-A", 2),
                new StockReservation(ORDER, "PROD-B", 1)));

        inventoryService.handle(EventEnvelope.wrap(
                new OrderCancelledEvent(ORDER, "u", "Payment failed", CancellationSource.PAYMENT_FAILED), "c"));
        inventoryService.handle(EventEnvelope.wrap(
                new OrderCancelledEvent(ORDER, "u", "timeout", CancellationSource.PAYMENT_TIMEOUT), "c"));

        verify(ledger, times(2)).release(ORDER, "PROD-A", 2);
        verify(ledger, times(2)).release(ORDER, "PROD-B", 1);
        verifyNoInteractions(outboxStore);
    }

    @Test
    void depletedCancellationReleasesNothing() {
        inventoryService.handle(EventEnvelope.wrap(
                new OrderCancelledEvent(ORDER, "u", "no stock", CancellationSource.INVENTORY_DEPLETED), "c"));

        verify(reservationRepository, never()).findByOrderId(anyString());
        verify(ledger, never()).release(anyString(), anyString(), anyInt());
    }

    private List<EventEnvelope> staged() {
        ArgumentCaptor<EventEnvelope> captor = ArgumentCaptor.forClass(EventEnvelope.class);
        verify(outboxStore, atLeast(0)).append(anyString(), captor.capture());
        return captor.getAllValues();
    }

    private List<String> aggregates() {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(outboxStore, atLeast(0)).append(captor.capture(), any(EventEnvelope.class));
        return captor.getAllValues();
    }

    private static EventEnvelope orderCreated(List<LineItem> items, String correlationId) {
        return EventEnvelope.wrap(new OrderCreatedEvent(ORDER, "user-1", items, BigDecimal.TEN), correlationId);
    }
}
