package com.ordersaga.messaging.consumer;

public enum ConsumeOutcome {
    PROCESSED,
    DUPLICATE
}
