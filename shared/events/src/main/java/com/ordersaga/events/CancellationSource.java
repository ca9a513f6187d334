package com.ordersaga.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CancellationSource {
    PAYMENT_FAILED("payment_failed"),
    INVENTORY_DEPLETED("inventory_depleted"),
    PAYMENT_TIMEOUT("payment_timeout");

    private final String wireName;

    CancellationSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Whether stock was reserved for the order before it was cancelled.
     */
    public boolean releasesStock() {
        return this != INVENTORY_DEPLETED;
    }

    @JsonCreator
    public static CancellationSource fromWireName(String value) {
        for (CancellationSource source : values()) {
            if (source.wireName.equals(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown cancellation source: " + value);
    }
}
