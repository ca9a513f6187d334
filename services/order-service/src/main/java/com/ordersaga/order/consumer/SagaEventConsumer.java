package com.ordersaga.order.consumer;

import com.ordersaga.events.EventTypes;
import com.ordersaga.messaging.consumer.ConsumeOutcome;
import com.ordersaga.messaging.consumer.IdempotentEventConsumer;
import com.ordersaga.order.saga.OrderSagaOrchestrator;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Component
public class SagaEventConsumer {

    private static final Logger log = LoggerFactory.getLogger(SagaEventConsumer.class);

    private final IdempotentEventConsumer eventConsumer;
    private final OrderSagaOrchestrator orchestrator;

    public SagaEventConsumer(IdempotentEventConsumer eventConsumer, OrderSagaOrchestrator orchestrator) {
        this.eventConsumer = eventConsumer;
        this.orchestrator = orchestrator;
    }

    @KafkaListener(topics = {
            EventTypes.CART_CHECKOUT_INITIATED,
            EventTypes.INVENTORY_RESERVED,
            EventTypes.INVENTORY_DEPLETED,
            EventTypes.PAYMENT_PROCESSED,
            EventTypes.PAYMENT_FAILED,
            EventTypes.ORDER_FULFILLED
    }, groupId = "order-service")
    public void consumeSagaEvent(ConsumerRecord<String, String> record) {
        ConsumeOutcome outcome = eventConsumer.consume(record.topic(), record.key(), record.value(),
                orchestrator::handle);
        log.debug("Record {}-{}@{} {}", record.topic(), record.partition(), record.offset(), outcome);
    }
}
