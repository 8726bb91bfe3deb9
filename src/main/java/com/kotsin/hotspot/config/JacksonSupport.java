package com.kotsin.hotspot.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kotsin.hotspot.time.InstantJsonModule;

/**
 * Builds the ObjectMapper shared by Kafka, the event store and the REST layer.
 */
public final class JacksonSupport {

    private JacksonSupport() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(new InstantJsonModule());
        return mapper;
    }
}
