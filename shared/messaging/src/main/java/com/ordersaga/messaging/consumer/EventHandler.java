package com.ordersaga.messaging.consumer;

import com.ordersaga.events.EventEnvelope;

/**
 * Applies one decoded event. Runs inside the transaction that also records the event as processed,
 * so any exception rolls back both.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(EventEnvelope envelope);
}
