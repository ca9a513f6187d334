package com.ordersaga.payment.service;

import com.ordersaga.events.EventEnvelope;
import com.ordersaga.events.OrderReservationConfirmedEvent;
import com.ordersaga.events.PaymentFailedEvent;
import com.ordersaga.events.PaymentProcessedEvent;
import com.ordersaga.messaging.outbox.OutboxStore;
import com.ordersaga.payment.entity.Payment;
import com.ordersaga.payment.repository.PaymentRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class PaymentService {

    private static final Logger log = LoggerFactory.getLogger(PaymentService.class);

    static final List<String> FAILURE_REASONS = List.of("insufficient_funds", "card_declined", "expired_card");

    private final PaymentRepository paymentRepository;
    private final OutboxStore outboxStore;
    private final MeterRegistry meterRegistry;
    private final double successRate;
    private final SimulatedOutcome forcedOutcome;

    public PaymentService(PaymentRepository paymentRepository,
                          OutboxStore outboxStore,
                          MeterRegistry meterRegistry,
                          @Value("${payment.simulate.success-rate:0.8}") double successRate,
                          @Value("${payment.simulate.force-outcome:}") String forceOutcome) {
        if (successRate < 0.0 || successRate > 1.0) {
            throw new IllegalArgumentException("payment.simulate.success-rate must be within [0, 1], got " + successRate);
        }
        this.paymentRepository = paymentRepository;
        this.outboxStore = outboxStore;
        this.meterRegistry = meterRegistry;
        this.successRate = successRate;
        this.forcedOutcome = SimulatedOutcome.fromProperty(forceOutcome);
    }

    @Transactional
    public void handle(EventEnvelope envelope) {
        if (envelope.payload() instanceof OrderReservationConfirmedEvent confirmed) {
            processPayment(confirmed, envelope.correlationId());
        } else {
            log.debug("Ignoring event type: {}", envelope.eventType());
        }
    }

    private void processPayment(OrderReservationConfirmedEvent confirmed, String correlationId) {
        String orderId = confirmed.orderId();
        if (paymentRepository.existsByOrderId(orderId)) {
            log.warn("Order {} already has a payment, ignoring repeated reservation confirmation", orderId);
            return;
        }

        if (simulatePayment(orderId)) {
            Payment payment = paymentRepository.save(
                    Payment.succeeded(orderId, confirmed.userId(), confirmed.totalAmount()));
            outboxStore.append(orderId, EventEnvelope.wrap(new PaymentProcessedEvent(
                    payment.getId(), orderId, payment.getUserId(), payment.getAmount(),
                    payment.getCurrency(), payment.getMethod()), correlationId));

            meterRegistry.counter("payments_processed_total", "outcome", "success").increment();
            log.info("Payment succeeded for order {}: paymentId={}", orderId, payment.getId());
        } else {
            String reason = failureReason(orderId);
            paymentRepository.save(Payment.failed(orderId, confirmed.userId(), confirmed.totalAmount(), reason));
            outboxStore.append(orderId, EventEnvelope.wrap(
                    new PaymentFailedEvent(orderId, confirmed.userId(), reason), correlationId));

            meterRegistry.counter("payments_processed_total", "outcome", "failure").increment();
            log.warn("Payment failed for order {}: {}", orderId, reason);
        }
    }

    // Same order id, same decision
    private boolean simulatePayment(String orderId) {
        if (forcedOutcome != SimulatedOutcome.RANDOM) {
            return forcedOutcome == SimulatedOutcome.SUCCESS;
        }
        return Math.floorMod(orderId.hashCode(), 100) < successRate * 100;
    }

    private static String failureReason(String orderId) {
        return FAILURE_REASONS.get(Math.floorMod(orderId.hashCode() / 100, FAILURE_REASONS.size()));
    }
}
