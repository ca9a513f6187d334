package com.ordersaga.messaging.consumer;

/**
 * Carries an {@link Error} raised by an {@link EventHandler} so the listener container treats it
 * like any other failed delivery.
 */
public class EventHandlingException extends RuntimeException {

    public EventHandlingException(String message, Throwable cause) {
        super(message, cause);
    }
}
