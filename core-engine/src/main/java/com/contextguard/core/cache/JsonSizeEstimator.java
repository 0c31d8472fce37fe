package com.contextguard.core.cache;

import com.contextguard.core.model.JsonMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Default {@link SizeEstimator}: the UTF-8 length of the payload's JSON
 * form.
 *
 * @since 1.0.0
 */
public class JsonSizeEstimator implements SizeEstimator {

    private final ObjectMapper mapper;

    public JsonSizeEstimator() {
        this(JsonMappers.create());
    }

    public JsonSizeEstimator(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public long estimate(Object payload) {
        try {
            return mapper.writeValueAsBytes(payload).length;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable: "
                    + payload.getClass().getName(), e);
        }
    }
}
