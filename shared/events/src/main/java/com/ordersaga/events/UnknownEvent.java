package com.ordersaga.events;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Payload of an event type this codebase does not model. Keeps the raw fields so the message can
 * be re-encoded without loss.
 */
public record UnknownEvent(ObjectNode fields) implements DomainEvent {}
