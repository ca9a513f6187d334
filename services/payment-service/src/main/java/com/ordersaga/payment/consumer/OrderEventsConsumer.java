package com.ordersaga.payment.consumer;

import com.ordersaga.events.EventTypes;
import com.ordersaga.messaging.consumer.ConsumeOutcome;
import com.ordersaga.messaging.consumer.IdempotentEventConsumer;
import com.ordersaga.payment.service.PaymentService;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Component
public class OrderEventsConsumer {

    private static final Logger log = LoggerFactory.getLogger(OrderEventsConsumer.class);

    private final IdempotentEventConsumer eventConsumer;
    private final PaymentService paymentService;

    public OrderEventsConsumer(IdempotentEventConsumer eventConsumer, PaymentService paymentService) {
        this.eventConsumer = eventConsumer;
        this.paymentService = paymentService;
    }

    @KafkaListener(topics = EventTypes.ORDER_RESERVATION_CONFIRMED, groupId = "payment-service")
    public void consume(ConsumerRecord<String, String> record) {
        ConsumeOutcome outcome = eventConsumer.consume(record.topic(), record.key(), record.value(),
                paymentService::handle);
        log.debug("Record {}-{}@{} {}", record.topic(), record.partition(), record.offset(), outcome);
    }
}
