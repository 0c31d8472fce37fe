package com.contextguard.core.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for the {@link ObjectMapper} configuration shared by persistence,
 * the remote client and the detection server.
 *
 * <p>
 * Instants and durations are written as ISO-8601 strings so that timestamps
 * round-trip to the nanosecond; unknown properties are ignored.
 * </p>
 *
 * @since 1.0.0
 */
public final class JsonMappers {

    private JsonMappers() {
        // utility class
    }

    /**
     * @return a newly configured mapper
     */
    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
