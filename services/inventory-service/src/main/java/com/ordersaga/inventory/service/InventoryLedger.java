package com.ordersaga.inventory.service;

import com.ordersaga.inventory.entity.StockReservation;
import com.ordersaga.inventory.repository.ProductRepository;
import com.ordersaga.inventory.repository.StockReservationRepository;
import com.ordersaga.inventory.repository.StockSnapshot;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Reserves and releases stock with optimistic concurrency. No row lock is held between reading a
 * product's stock and writing it back; the version column detects concurrent writers, and a
 * conflicting write is re-read and retried a bounded number of times.
 */
@Component
public class InventoryLedger {

    private static final Logger log = LoggerFactory.getLogger(InventoryLedger.class);

    static final int MAX_ATTEMPTS = 3;

    private final ProductRepository productRepository;
    private final StockReservationRepository reservationRepository;
    private final MeterRegistry meterRegistry;

    public InventoryLedger(ProductRepository productRepository,
                           StockReservationRepository reservationRepository,
                           MeterRegistry meterRegistry) {
        this.productRepository = productRepository;
        this.reservationRepository = reservationRepository;
        this.meterRegistry = meterRegistry;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public ReservationOutcome reserve(String orderId, String productId, int quantity) {
        if (quantity <= 0) {
            return ReservationOutcome.rejected(ReservationOutcome.Status.INVALID_QUANTITY, 0);
        }
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Optional<StockSnapshot> snapshot = productRepository.findStockSnapshot(productId);
            if (snapshot.isEmpty()) {
                return ReservationOutcome.rejected(ReservationOutcome.Status.UNKNOWN_PRODUCT, 0);
            }
            StockSnapshot observed = snapshot.get();
            if (observed.stock() < quantity) {
                return ReservationOutcome.rejected(ReservationOutcome.Status.INSUFFICIENT_STOCK, observed.stock());
            }
            if (productRepository.decrementStock(productId, quantity, observed.version(), Instant.now()) == 1) {
                reservationRepository.save(new StockReservation(orderId, productId, quantity));
                meterRegistry.counter("stock_reserved_total").increment();
                log.info("Reserved {} x {} for order {} (stock {} -> {})",
                        quantity, productId, orderId, observed.stock(), observed.stock() - quantity);
                return ReservationOutcome.reserved(observed.stock() - quantity);
            }
            meterRegistry.counter("stock_reservation_conflicts_total").increment();
            log.debug("Version conflict reserving {} for order {} (attempt {}/{})",
                    productId, orderId, attempt, MAX_ATTEMPTS);
        }
        log.warn("Gave up reserving {} for order {} after {} conflicting attempts", productId, orderId, MAX_ATTEMPTS);
        return ReservationOutcome.rejected(ReservationOutcome.Status.CONFLICT_EXHAUSTED, 0);
    }

    /**
     * Returns a reservation's stock and deletes the reservation. Does nothing when the order holds
     * no reservation for the product, so a reservation is released at most once.
     *
     * @return whether stock was returned
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean release(String orderId, String productId, int quantity) {
        Optional<StockReservation> reservation = reservationRepository.findByOrderIdAndProductId(orderId, productId);
        if (reservation.isEmpty()) {
            log.warn("No reservation of {} for order {}, nothing to release", productId, orderId);
            return false;
        }
        if (reservation.get().getQuantity() != quantity) {
            log.warn("Release of {} x {} for order {} does not match reserved quantity {}, releasing the reserved quantity",
                    quantity, productId, orderId, reservation.get().getQuantity());
        }
        int reserved = reservation.get().getQuantity();
        reservationRepository.delete(reservation.get());
        productRepository.incrementStock(productId, reserved, Instant.now());
        meterRegistry.counter("stock_released_total").increment();
        log.info("Released {} x {} for order {}", reserved, productId, orderId);
        return true;
    }
}
