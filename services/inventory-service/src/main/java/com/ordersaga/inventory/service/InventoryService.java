package com.ordersaga.inventory.service;

import com.ordersaga.events.DomainEvent;
import com.ordersaga.events.EventEnvelope;
import com.ordersaga.events.InventoryDepletedEvent;
import com.ordersaga.events.InventoryLowEvent;
import com.ordersaga.events.InventoryReservedEvent;
import com.ordersaga.events.LineItem;
import com.ordersaga.events.OrderCancelledEvent;
import com.ordersaga.events.OrderCreatedEvent;
import com.ordersaga.inventory.entity.StockReservation;
import com.ordersaga.inventory.repository.StockReservationRepository;
import com.ordersaga.messaging.outbox.OutboxStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
public class InventoryService {

    private static final Logger log = LoggerFactory.getLogger(InventoryService.class);

    private final InventoryLedger ledger;
    private final StockReservationRepository reservationRepository;
    private final OutboxStore outboxStore;
    private final MeterRegistry meterRegistry;
    private final int lowStockThreshold;

    public InventoryService(InventoryLedger ledger,
                            StockReservationRepository reservationRepository,
                            OutboxStore outboxStore,
                            MeterRegistry meterRegistry,
                            @Value("${inventory.low-stock-threshold:10}") int lowStockThreshold) {
        this.ledger = ledger;
        this.reservationRepository = reservationRepository;
        this.outboxStore = outboxStore;
        this.meterRegistry = meterRegistry;
        this.lowStockThreshold = lowStockThreshold;
    }

    @Transactional
    public void handle(EventEnvelope envelope) {
        DomainEvent payload = envelope.payload();
        if (payload instanceof OrderCreatedEvent created) {
            reserveOrder(created, envelope.correlationId());
        } else if (payload instanceof OrderCancelledEvent cancelled) {
            releaseCancelledOrder(cancelled);
        } else {
            log.debug("Ignoring event type: {}", envelope.eventType());
        }
    }

    /**
     * Reserves every line of the order or none of them. Lines of the same product are reserved
     * together, in product id order.
     */
    private void reserveOrder(OrderCreatedEvent created, String correlationId) {
        String orderId = created.orderId();
        if (reservationRepository.existsByOrderId(orderId)) {
            log.warn("Order {} already holds reservations, ignoring repeated order.created", orderId);
            return;
        }
        List<LineItem> items = created.items() == null ? List.of() : created.items();
        if (items.isEmpty()) {
            reject(orderId, null, "no_items", correlationId);
            return;
        }

        Map<String, Integer> quantities = new TreeMap<>();
        items.forEach(item -> quantities.merge(item.productId(), item.quantity(), Integer::sum));

        Map<String, Integer> reserved = new LinkedHashMap<>();
        List<InventoryLowEvent> lowStock = new ArrayList<>();
        for (Map.Entry<String, Integer> line : quantities.entrySet()) {
            ReservationOutcome outcome = ledger.reserve(orderId, line.getKey(), line.getValue());
            if (!outcome.isReserved()) {
                reserved.forEach((productId, quantity) -> ledger.release(orderId, productId, quantity));
                reject(orderId, line.getKey(), outcome.status().reason(), correlationId);
                return;
            }
            reserved.put(line.getKey(), line.getValue());
            if (outcome.remainingStock() < lowStockThreshold) {
                lowStock.add(new InventoryLowEvent(line.getKey(), outcome.remainingStock(), lowStockThreshold));
            }
        }

        LineItem first = items.get(0);
        outboxStore.append(orderId, EventEnvelope.wrap(
                new InventoryReservedEvent(orderId, first.productId(), quantities.get(first.productId()), items), correlationId));
        for (InventoryLowEvent low : lowStock) {
            outboxStore.append(low.productId(), EventEnvelope.wrap(low, correlationId));
            meterRegistry.counter("inventory_low_alerts_total").increment();
            log.warn("Low stock for product {}: {} left (threshold {})",
                    low.productId(), low.currentStock(), low.threshold());
        }
        meterRegistry.counter("orders_reserved_total").increment();
        log.info("Stock reserved for order {} ({} products)", orderId, reserved.size());
    }

    private void reject(String orderId, String productId, String reason, String correlationId) {
        outboxStore.append(orderId, EventEnvelope.wrap(
                new InventoryDepletedEvent(orderId, productId, reason), correlationId));
        meterRegistry.counter("orders_rejected_total", "reason", reason).increment();
        log.warn("Stock rejected for order {}: {} ({})", orderId, reason, productId);
    }

    private void releaseCancelledOrder(OrderCancelledEvent cancelled) {
        if (cancelled.cancellationSource() == null || !cancelled.cancellationSource().releasesStock()) {
            log.info("Order {} cancelled ({}), no stock to release", cancelled.orderId(),
                    cancelled.cancellationSource() == null ? "no source" : cancelled.cancellationSource().wireName());
            return;
        }
        List<StockReservation> reservations = reservationRepository.findByOrderId(cancelled.orderId());
        int released = 0;
        for (StockReservation reservation : reservations) {
            if (ledger.release(reservation.getOrderId(), reservation.getProductId(), reservation.getQuantity())) {
                released++;
            }
        }
        log.info("Order {} cancelled ({}), released {} reservations",
                cancelled.orderId(), cancelled.cancellationSource().wireName(), released);
    }
}
