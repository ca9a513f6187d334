package com.ordersaga.payment.service;

import java.util.Locale;

/**
 * Override for the simulated provider. {@link #RANDOM} keeps the configured success rate.
 */
public enum SimulatedOutcome {
    RANDOM,
    SUCCESS,
    FAILURE;

    public static SimulatedOutcome fromProperty(String value) {
        if (value == null || value.isBlank()) {
            return RANDOM;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "payment.simulate.force-outcome must be 'success' or 'failure', got '" + value + "'", e);
        }
    }
}
