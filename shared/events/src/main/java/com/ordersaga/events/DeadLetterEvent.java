package com.ordersaga.events;

/**
 * A message that could not be processed. {@code payload} holds the original message text verbatim.
 */
public record DeadLetterEvent(
        String originalTopic,
        String originalEventType,
        String errorReason,
        int retryCount,
        String payload
) implements DomainEvent {}
