package com.ordersaga.events.serde;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;

public final class EventObjectMapper {

    private static final ObjectMapper INSTANCE;

    static {
        INSTANCE = new ObjectMapper();
        INSTANCE.registerModule(new JavaTimeModule());
        // registered after JavaTimeModule so it takes precedence for Instant
        INSTANCE.registerModule(new SimpleModule("lenient-instant")
                .addDeserializer(Instant.class, new LenientInstantDeserializer()));
        INSTANCE.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        INSTANCE.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        INSTANCE.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private EventObjectMapper() {}

    public static ObjectMapper instance() {
        return INSTANCE;
    }
}
