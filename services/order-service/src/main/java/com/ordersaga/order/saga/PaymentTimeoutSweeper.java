package com.ordersaga.order.saga;

import com.ordersaga.order.entity.Order;
import com.ordersaga.order.entity.OrderStatus;
import com.ordersaga.order.repository.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Cancels orders whose stock is reserved but whose payment never arrived.
 */
@Component
public class PaymentTimeoutSweeper {

    private static final Logger log = LoggerFactory.getLogger(PaymentTimeoutSweeper.class);

    private final OrderRepository orderRepository;
    private final OrderSagaOrchestrator orchestrator;
    private final Duration ttl;

    public PaymentTimeoutSweeper(OrderRepository orderRepository,
                                 OrderSagaOrchestrator orchestrator,
                                 @Value("${saga.payment-timeout.ttl:15m}") Duration ttl) {
        this.orderRepository = orderRepository;
        this.orchestrator = orchestrator;
        this.ttl = ttl;
    }

    @Scheduled(fixedDelayString = "${saga.payment-timeout.check-interval-ms:60000}")
    public void cancelExpiredReservations() {
        int cancelled = sweep(Instant.now());
        if (cancelled > 0) {
            log.info("Cancelled {} orders waiting for payment longer than {}", cancelled, ttl);
        }
    }

    public int sweep(Instant now) {
        Instant cutoff = now.minus(ttl);
        List<Order> expired = orderRepository.findTop100ByStatusAndUpdatedAtBeforeOrderByUpdatedAtAsc(
                OrderStatus.RESERVATION_CONFIRMED, cutoff);
        int cancelled = 0;
        for (Order order : expired) {
            try {
                if (orchestrator.expirePayment(order.getId(), cutoff)) {
                    cancelled++;
                }
            } catch (OptimisticLockingFailureException e) {
                log.warn("Order {} changed while expiring its payment window, leaving it for the saga: {}",
                        order.getId(), e.getMessage());
            }
        }
        return cancelled;
    }
}
