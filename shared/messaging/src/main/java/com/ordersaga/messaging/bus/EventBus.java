package com.ordersaga.messaging.bus;

/**
 * Publishes an already encoded message. Returns only after the broker acknowledged the write.
 */
public interface EventBus {

    void publish(String topic, String key, String payload);
}
