package com.ordersaga.inventory.consumer;

import com.ordersaga.events.EventTypes;
import com.ordersaga.inventory.service.InventoryService;
import com.ordersaga.messaging.consumer.ConsumeOutcome;
import com.ordersaga.messaging.consumer.IdempotentEventConsumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Component
public class OrderEventsConsumer {

    private static final Logger log = LoggerFactory.getLogger(OrderEventsConsumer.class);

    private final IdempotentEventConsumer eventConsumer;
    private final InventoryService inventoryService;

    public OrderEventsConsumer(IdempotentEventConsumer eventConsumer, InventoryService inventoryService) {
        this.eventConsumer = eventConsumer;
        this.inventoryService = inventoryService;
    }

    @KafkaListener(topics = {EventTypes.ORDER_CREATED, EventTypes.ORDER_CANCELLED}, groupId = "inventory-service")
    public void consume(ConsumerRecord<String, String> record) {
        ConsumeOutcome outcome = eventConsumer.consume(record.topic(), record.key(), record.value(),
                inventoryService::handle);
        log.debug("Record {}-{}@{} {}", record.topic(), record.partition(), record.offset(), outcome);
    }
}
